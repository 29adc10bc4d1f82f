package com.finpulse.ingest.service.reader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UzumWebhookTranslator Unit Tests")
class UzumWebhookTranslatorTest {

    private UzumWebhookTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new UzumWebhookTranslator();
    }

    @Test
    @DisplayName("Should translate a payment callback into a raw record")
    void shouldTranslatePaymentCallback() {
        // Given
        Map<String, Object> payload = Map.of(
                "transId", 987654,
                "amount", 150000,
                "timestamp", 1_700_000_000_000L);

        // When
        Map<String, Object> record = translator.translate(payload, "confirm");

        // Then
        assertThat(record)
                .containsEntry("date", "2023-11-14T22:13:20Z")
                .containsEntry("amount", 150000)
                .containsEntry("merchant", "Uzum Bank")
                .containsEntry("category", null)
                .containsEntry("description", "Uzum webhook: confirm")
                .containsEntry("external_id", 987654)
                .containsEntry("source", "uzum_webhook");
        assertThat(record.get("raw_payload")).isSameAs(payload);
    }

    @Test
    @DisplayName("Should fall back to transTime and confirmTime when timestamp is absent")
    void shouldFallBackThroughTimestampKeys() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("timestamp", null);
        payload.put("confirmTime", "1700000000000");

        assertThat(translator.translate(payload, "confirm")).containsEntry("date", "2023-11-14T22:13:20Z");

        payload.put("transTime", 1_600_000_000_000L);
        assertThat(translator.translate(payload, "create")).containsEntry("date", "2020-09-13T12:26:40Z");
    }

    @Test
    @DisplayName("Should treat a blank timestamp as absent and use the next key")
    void shouldSkipBlankTimestamp() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("timestamp", "");
        payload.put("transTime", 1_700_000_000_000L);

        assertThat(translator.translate(payload, "confirm")).containsEntry("date", "2023-11-14T22:13:20Z");

        payload.put("timestamp", "  ");
        assertThat(translator.translate(payload, "confirm")).containsEntry("date", "2023-11-14T22:13:20Z");
    }

    @Test
    @DisplayName("Should leave the date empty when no timestamp is usable")
    void shouldLeaveDateEmptyWhenUnparseable() {
        assertThat(translator.translate(Map.of("transId", "x"), "check")).containsEntry("date", null);
        assertThat(translator.translate(Map.of("timestamp", "soon"), "check")).containsEntry("date", null);
    }
}
