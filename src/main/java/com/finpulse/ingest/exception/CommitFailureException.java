package com.finpulse.ingest.exception;

/**
 * Storage failed while committing a batch. Everything staged by the call has
 * been rolled back when this is thrown.
 */
public class CommitFailureException extends IngestionException {

    private final int stagedCount;

    public CommitFailureException(String message, int stagedCount, Throwable cause) {
        super(message, cause);
        this.stagedCount = stagedCount;
    }

    public int getStagedCount() {
        return stagedCount;
    }
}
