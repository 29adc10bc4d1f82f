package com.finpulse.ingest.exception;

/**
 * Thrown when uploaded delimited text cannot be decoded under any supported
 * encoding, or cannot be parsed as a header-delimited table.
 */
public class DecodeException extends IngestionException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
