package com.finpulse.ingest.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Tally of one batch load.
 */
public record LoadResult(int saved, int duplicates, List<RowError> errors) {

    public LoadResult {
        errors = List.copyOf(errors);
    }

    /**
     * Folds per-row outcomes, given in input order, into counts.
     * Failed rows become errors tagged with their 1-based position.
     */
    public static LoadResult fold(List<RowOutcome> outcomes) {
        int saved = 0;
        int duplicates = 0;
        List<RowError> errors = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            RowOutcome outcome = outcomes.get(i);
            if (outcome instanceof RowOutcome.Inserted) {
                saved++;
            } else if (outcome instanceof RowOutcome.Duplicate) {
                duplicates++;
            } else if (outcome instanceof RowOutcome.Failed failed) {
                errors.add(new RowError(i + 1, failed.reason()));
            }
        }
        return new LoadResult(saved, duplicates, errors);
    }

    public static LoadResult empty() {
        return new LoadResult(0, 0, List.of());
    }
}
