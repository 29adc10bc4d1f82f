package com.finpulse.ingest.service;

import com.finpulse.ingest.domain.CanonicalTransaction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the dedup identity of a transaction.
 * <p>
 * The fingerprint is the SHA-256 hex digest of
 * {@code date|amount|merchant|source}. Category, description and external id
 * do not take part: two records of the same economic event that differ only in
 * those fields collapse into one stored row.
 */
@Component
public class FingerprintGenerator {

    private static final String SEPARATOR = "|";

    public String fingerprint(CanonicalTransaction transaction) {
        String key = String.join(SEPARATOR,
                asText(transaction.date()),
                asText(transaction.amount()),
                asText(transaction.merchant()),
                asText(transaction.source()));
        return sha256Hex(key);
    }

    /**
     * Returns the transaction carrying its own fingerprint.
     */
    public CanonicalTransaction attach(CanonicalTransaction transaction) {
        return transaction.withTransactionHash(fingerprint(transaction));
    }

    private static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    private static String sha256Hex(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest unavailable", ex);
        }
    }
}
