package com.finpulse.ingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Source vocabulary and decoding settings for the ingestion pipeline.
 *
 * @param csv          charsets tried when decoding uploaded delimited text
 * @param fieldAliases extra source keys per canonical field, appended after the
 *                     built-in candidates; keyed by {@code CanonicalField#configKey()}
 */
@ConfigurationProperties(prefix = "finpulse.ingestion")
public record IngestionProperties(
        Csv csv,
        Map<String, List<String>> fieldAliases
) {

    public IngestionProperties {
        if (csv == null) {
            csv = new Csv(null, null);
        }
        fieldAliases = fieldAliases == null ? Map.of() : Map.copyOf(fieldAliases);
    }

    public static IngestionProperties defaults() {
        return new IngestionProperties(null, null);
    }

    public List<String> aliasesFor(String configKey) {
        // map keys are bound verbatim, so accept external_id as well as external-id
        List<String> aliases = fieldAliases.get(configKey);
        return aliases != null ? aliases : fieldAliases.getOrDefault(configKey.replace('-', '_'), List.of());
    }

    public record Csv(String primaryCharset, String fallbackCharset) {
        public Csv {
            if (primaryCharset == null || primaryCharset.isBlank()) {
                primaryCharset = "UTF-8";
            }
            if (fallbackCharset == null || fallbackCharset.isBlank()) {
                fallbackCharset = "windows-1251";
            }
        }
    }
}
