package com.finpulse.ingest.domain;

/**
 * Unified shape every source record is mapped into before loading.
 * <p>
 * Values are kept as extracted: {@code date} and {@code amount} may still be
 * strings in source formatting. {@code transactionHash} is attached last via
 * {@link #withTransactionHash(String)} so the hash always belongs to the exact
 * field values it was computed from.
 */
public record CanonicalTransaction(
        Object date,
        Object amount,
        String merchant,
        String category,
        String description,
        String externalId,
        Object rawPayload,
        String source,
        String transactionHash
) {

    /**
     * Returns a copy of this transaction carrying the given fingerprint.
     */
    public CanonicalTransaction withTransactionHash(String hash) {
        return new CanonicalTransaction(
                date, amount, merchant, category, description, externalId, rawPayload, source, hash);
    }
}
