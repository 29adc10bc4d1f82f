package com.finpulse.ingest.domain;

import java.util.List;

/**
 * What an ingestion call reports back to its caller.
 *
 * @param batchId    correlation id of the call, also present in its log lines
 * @param total      number of records the source produced
 * @param saved      records newly stored
 * @param duplicates records skipped because their fingerprint was already stored
 * @param errors     records rejected, with their position in the source
 */
public record IngestionSummary(
        String batchId,
        int total,
        int saved,
        int duplicates,
        List<RowError> errors
) {

    public IngestionSummary {
        errors = List.copyOf(errors);
    }
}
