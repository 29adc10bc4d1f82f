package com.finpulse.ingest.domain;

import java.util.List;

/**
 * Canonical fields resolved from raw source records, each with the source keys
 * tried in order. The first key holding a usable value wins.
 */
public enum CanonicalField {

    DATE("date", List.of("date", "Date", "created_at", "timestamp", "Дата", "created_time", "created_datetime")),
    AMOUNT("amount", List.of("amount", "Amount", "Сумма", "value")),
    MERCHANT("merchant", List.of("merchant", "Merchant", "recipient", "payee", "Получатель")),
    CATEGORY("category", List.of("category", "Category", "Категория")),
    DESCRIPTION("description", List.of("description", "Description", "note", "Описание")),
    EXTERNAL_ID("external-id", List.of("id", "transaction_id", "payment_id", "external_id"));

    private final String configKey;
    private final List<String> defaultCandidates;

    CanonicalField(String configKey, List<String> defaultCandidates) {
        this.configKey = configKey;
        this.defaultCandidates = defaultCandidates;
    }

    /**
     * Key under {@code finpulse.ingestion.field-aliases} that extends this field's vocabulary.
     */
    public String configKey() {
        return configKey;
    }

    public List<String> defaultCandidates() {
        return defaultCandidates;
    }
}
