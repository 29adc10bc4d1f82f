package com.finpulse.ingest.util;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Issues the id of one ingestion call. The id tags every log line of the call
 * through the MDC and is returned in the ingestion summary, so callers can
 * find the logs of a batch they submitted.
 * <p>
 * Ids only need to be unique across calls, not unguessable, so they are drawn
 * from ThreadLocalRandom and concurrent ingestions never share a generator.
 */
@Component
public class BatchIdGenerator {

    private static final long VERSION_MASK = 0xffffffffffff0fffL;
    private static final long VERSION_4 = 0x0000000000004000L;
    private static final long VARIANT_MASK = 0x3fffffffffffffffL;
    private static final long IETF_VARIANT = 0x8000000000000000L;

    /**
     * @return a new batch id, formatted as a lowercase random (version 4) UUID
     */
    public String generate() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        long high = (random.nextLong() & VERSION_MASK) | VERSION_4;
        long low = (random.nextLong() & VARIANT_MASK) | IETF_VARIANT;
        return new UUID(high, low).toString();
    }
}
