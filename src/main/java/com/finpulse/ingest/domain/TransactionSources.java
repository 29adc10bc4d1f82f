package com.finpulse.ingest.domain;

/**
 * Source tags written to {@code transactions.source}.
 * Callers may pass their own tag for CSV and API ingestion (e.g. "payme").
 */
public final class TransactionSources {

    public static final String CSV = "csv";
    public static final String API = "api";
    public static final String UZUM_WEBHOOK = "uzum_webhook";

    private TransactionSources() {
    }
}
