package com.finpulse.ingest.service;

import com.finpulse.ingest.domain.CanonicalTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FingerprintGenerator Unit Tests")
class FingerprintGeneratorTest {

    private FingerprintGenerator fingerprintGenerator;

    @BeforeEach
    void setUp() {
        fingerprintGenerator = new FingerprintGenerator();
    }

    @Test
    @DisplayName("Should hash date, amount, merchant and source as SHA-256 hex")
    void shouldHashIdentifyingFields() {
        CanonicalTransaction tx = transaction("2024-01-15", "-45000.50", "Korzinka", "csv", "Groceries", "weekly");

        assertThat(fingerprintGenerator.fingerprint(tx))
                .isEqualTo("4a53096fe51ad767eb0116d444b23481db1db88daf829cd21ef59745466547b5");
    }

    @Test
    @DisplayName("Should ignore category, description and external id")
    void shouldIgnoreNonIdentifyingFields() {
        CanonicalTransaction first = transaction("2024-01-15", "-45000.50", "Korzinka", "csv", "Groceries", "weekly");
        CanonicalTransaction second = new CanonicalTransaction(
                "2024-01-15", "-45000.50", "Korzinka", "Food", "other note", "ext-99",
                Map.of("x", 1), "csv", null);

        assertThat(fingerprintGenerator.fingerprint(first))
                .isEqualTo(fingerprintGenerator.fingerprint(second));
    }

    @Test
    @DisplayName("Should distinguish sources for otherwise identical records")
    void shouldDistinguishSources() {
        CanonicalTransaction csv = transaction("2024-01-15", "100", "Korzinka", "csv", null, null);
        CanonicalTransaction api = transaction("2024-01-15", "100", "Korzinka", "api", null, null);

        assertThat(fingerprintGenerator.fingerprint(csv))
                .isNotEqualTo(fingerprintGenerator.fingerprint(api));
    }

    @Test
    @DisplayName("Should render missing fields as empty strings")
    void shouldRenderMissingFieldsAsEmpty() {
        CanonicalTransaction tx = transaction(null, null, null, "api", null, null);

        assertThat(fingerprintGenerator.fingerprint(tx))
                .isEqualTo("d552ab3d182fd0484d51861ceab30ba876bf0b49354f357e1a29c7067753c00b");
    }

    @Test
    @DisplayName("Should render BigDecimal amounts in plain notation")
    void shouldRenderBigDecimalPlain() {
        CanonicalTransaction decimal = transaction("2024-01-15", new BigDecimal("1E+2"), "Korzinka", "csv", null, null);

        assertThat(fingerprintGenerator.fingerprint(decimal))
                .isEqualTo("3328363f3059e3c606503adbe586f11617a834e07f61af12ab2beff1c498a4ae");
    }

    @Test
    @DisplayName("Should attach the fingerprint without altering other fields")
    void shouldAttachFingerprint() {
        CanonicalTransaction tx = transaction("2024-01-15", "100", "Korzinka", "csv", "Food", null);

        CanonicalTransaction attached = fingerprintGenerator.attach(tx);

        assertThat(attached.transactionHash()).hasSize(64).matches("[0-9a-f]{64}");
        assertThat(attached.withTransactionHash(null)).isEqualTo(tx);
    }

    private static CanonicalTransaction transaction(Object date, Object amount, String merchant,
                                                    String source, String category, String description) {
        return new CanonicalTransaction(date, amount, merchant, category, description, null, null, source, null);
    }
}
