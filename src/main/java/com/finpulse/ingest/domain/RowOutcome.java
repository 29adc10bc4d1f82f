package com.finpulse.ingest.domain;

/**
 * Result of offering a single transaction to the batch loader.
 */
public sealed interface RowOutcome permits RowOutcome.Inserted, RowOutcome.Duplicate, RowOutcome.Failed {

    record Inserted(String transactionHash) implements RowOutcome {
    }

    record Duplicate(String transactionHash) implements RowOutcome {
    }

    record Failed(String reason) implements RowOutcome {
    }
}
