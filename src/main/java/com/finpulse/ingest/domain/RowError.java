package com.finpulse.ingest.domain;

/**
 * A record that could not be canonicalized or staged.
 *
 * @param position 1-based position of the record in the ingested batch
 * @param message  why the record was rejected
 */
public record RowError(int position, String message) {

    @Override
    public String toString() {
        return "Row " + position + ": " + message;
    }
}
