package com.finpulse.ingest.service.reader;

import com.finpulse.ingest.domain.TransactionSources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns one Uzum Bank webhook callback into a raw record the canonicalizer
 * understands. Uzum sends epoch milliseconds under one of several keys
 * depending on the event.
 */
@Slf4j
@Component
public class UzumWebhookTranslator {

    public static final String MERCHANT_LABEL = "Uzum Bank";

    private static final List<String> TIMESTAMP_KEYS = List.of("timestamp", "transTime", "confirmTime");

    public Map<String, Object> translate(Map<String, Object> payload, String eventType) {
        Objects.requireNonNull(payload, "webhook payload");

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("date", toIsoInstant(firstPresent(payload)));
        record.put("amount", payload.get("amount"));
        record.put("merchant", MERCHANT_LABEL);
        record.put("category", null);
        record.put("description", "Uzum webhook: " + eventType);
        record.put("external_id", payload.get("transId"));
        record.put("raw_payload", payload);
        record.put("source", TransactionSources.UZUM_WEBHOOK);
        return record;
    }

    private static Object firstPresent(Map<String, Object> payload) {
        for (String key : TIMESTAMP_KEYS) {
            Object value = payload.get(key);
            if (value != null && !(value instanceof CharSequence text && text.toString().isBlank())) {
                return value;
            }
        }
        return null;
    }

    private static String toIsoInstant(Object epochMillis) {
        if (epochMillis == null) {
            return null;
        }
        try {
            long millis = epochMillis instanceof Number number
                    ? number.longValue()
                    : new BigDecimal(epochMillis.toString().trim()).longValueExact();
            return Instant.ofEpochMilli(millis).toString();
        } catch (NumberFormatException | ArithmeticException e) {
            log.warn("Ignoring unparseable webhook timestamp: {}", epochMillis);
            return null;
        }
    }
}
