package com.finpulse.ingest.service;

import com.finpulse.ingest.config.IngestionProperties;
import com.finpulse.ingest.domain.CanonicalField;
import com.finpulse.ingest.domain.CanonicalTransaction;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps raw records from any source into {@link CanonicalTransaction}.
 * <p>
 * Every canonical field has an ordered list of candidate source keys: the
 * built-in vocabulary of {@link CanonicalField}, followed by any aliases
 * configured under {@code finpulse.ingestion.field-aliases}. The first key
 * whose value is neither null nor an empty string wins. Keys no list mentions
 * are ignored, so a source using an unknown label for a field loses that field.
 */
@Service
public class Canonicalizer {

    static final String RAW_PAYLOAD_KEY = "raw_payload";

    private final Map<CanonicalField, List<String>> candidates;
    private final FingerprintGenerator fingerprintGenerator;

    public Canonicalizer(IngestionProperties properties, FingerprintGenerator fingerprintGenerator) {
        this.fingerprintGenerator = fingerprintGenerator;
        this.candidates = new EnumMap<>(CanonicalField.class);
        for (CanonicalField field : CanonicalField.values()) {
            List<String> keys = new ArrayList<>(field.defaultCandidates());
            for (String alias : properties.aliasesFor(field.configKey())) {
                if (!keys.contains(alias)) {
                    keys.add(alias);
                }
            }
            candidates.put(field, Collections.unmodifiableList(keys));
        }
    }

    /**
     * Canonicalizes one raw record and attaches its fingerprint.
     *
     * @param raw    raw record as produced by a source reader
     * @param source source tag stored with the transaction
     * @return fingerprinted canonical transaction
     */
    public CanonicalTransaction canonicalize(Map<String, Object> raw, String source) {
        Objects.requireNonNull(raw, "raw record");

        Object externalId = resolve(raw, CanonicalField.EXTERNAL_ID);
        Object rawPayload = raw.containsKey(RAW_PAYLOAD_KEY) ? raw.get(RAW_PAYLOAD_KEY) : raw;

        CanonicalTransaction transaction = new CanonicalTransaction(
                resolve(raw, CanonicalField.DATE),
                resolve(raw, CanonicalField.AMOUNT),
                text(resolve(raw, CanonicalField.MERCHANT)),
                text(resolve(raw, CanonicalField.CATEGORY)),
                text(resolve(raw, CanonicalField.DESCRIPTION)),
                text(externalId),
                rawPayload,
                source,
                null
        );
        return fingerprintGenerator.attach(transaction);
    }

    List<String> candidatesFor(CanonicalField field) {
        return candidates.get(field);
    }

    private Object resolve(Map<String, Object> raw, CanonicalField field) {
        for (String key : candidates.get(field)) {
            Object value = raw.get(key);
            if (isPresent(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean isPresent(Object value) {
        return value != null && !(value instanceof CharSequence text && text.length() == 0);
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
