package com.finpulse.ingest.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Raw transaction row as loaded by the ingestion pipeline.
 * Downstream transform/aggregate stages flip {@code processed} once they have
 * consumed the row; nothing in this service updates a stored row.
 */
@Entity
@Table(name = "transactions", indexes = {
        @Index(name = "idx_transactions_owner", columnList = "owner_id"),
        @Index(name = "idx_transactions_account", columnList = "account_id"),
        @Index(name = "idx_transactions_category", columnList = "category"),
        @Index(name = "idx_transactions_processed", columnList = "processed"),
        @Index(name = "idx_transactions_external_id", columnList = "external_id"),
        @Index(name = "idx_transactions_created_at", columnList = "created_at"),
        @Index(name = "idx_owner_processed", columnList = "owner_id, processed"),
        @Index(name = "idx_owner_date", columnList = "owner_id, created_at")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    // null for manual uploads not tied to an account
    @Column(name = "account_id")
    private Long accountId;

    // positive = income, negative = expense
    @NotNull(message = "amount is required")
    @Digits(integer = 13, fraction = 2, message = "amount exceeds NUMERIC(15,2)")
    @Column(name = "amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @NotBlank
    @Size(max = 3)
    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Size(max = 255, message = "merchant longer than 255 characters")
    @Column(name = "merchant", length = 255)
    private String merchant;

    @Size(max = 100, message = "category longer than 100 characters")
    @Column(name = "category", length = 100)
    private String category;

    @Size(max = 65535)
    @Column(name = "description", length = 65535)
    private String description;

    @Size(max = 255, message = "external id longer than 255 characters")
    @Column(name = "external_id", length = 255)
    private String externalId;

    @NotBlank
    @Size(max = 32)
    @Column(name = "source", nullable = false, length = 32)
    private String source;

    // original record as JSON text, kept for audit and reprocessing
    @Size(max = 1048576, message = "raw payload larger than 1 MiB")
    @Column(name = "raw_payload", length = 1048576)
    private String rawPayload;

    @NotBlank
    @Size(min = 64, max = 64)
    @Column(name = "transaction_hash", nullable = false, unique = true, length = 64)
    private String transactionHash;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    // when the transaction happened, or ingestion time when the source date is unusable
    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "ingested_at", nullable = false)
    private Instant ingestedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
