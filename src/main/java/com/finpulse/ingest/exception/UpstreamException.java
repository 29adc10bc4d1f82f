package com.finpulse.ingest.exception;

/**
 * Exception thrown when a transaction source API cannot be read.
 * Carries the HTTP status for non-2xx responses; zero when the failure
 * happened before a status was received (timeout, connection refused,
 * circuit open).
 */
public class UpstreamException extends IngestionException {

    private final int statusCode;

    public UpstreamException(String message) {
        super(message);
        this.statusCode = 0;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public UpstreamException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return "UpstreamException{" +
               "message='" + getMessage() + '\'' +
               ", statusCode=" + statusCode +
               '}';
    }
}
