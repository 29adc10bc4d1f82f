package com.finpulse.ingest.exception;

/**
 * Thrown when an API response body is neither a list of records nor an object
 * that wraps one under a recognized key.
 */
public class UnexpectedShapeException extends IngestionException {

    public UnexpectedShapeException(String message) {
        super(message);
    }

    public UnexpectedShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
