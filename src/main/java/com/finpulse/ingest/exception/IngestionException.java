package com.finpulse.ingest.exception;

/**
 * Base type for failures that abort a whole ingestion call.
 * Row-level problems are never thrown; they are reported as row errors.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
