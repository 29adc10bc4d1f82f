package com.finpulse.ingest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finpulse.ingest.domain.CanonicalTransaction;
import com.finpulse.ingest.domain.LoadResult;
import com.finpulse.ingest.domain.RowOutcome;
import com.finpulse.ingest.domain.TransactionEntity;
import com.finpulse.ingest.exception.CommitFailureException;
import com.finpulse.ingest.util.TransactionDates;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Persists fingerprinted transactions for one owner in a single commit.
 * Responsibilities:
 * - Skip rows whose fingerprint is already stored or already staged in the batch
 * - Build and validate one entity per new row, isolating per-row failures
 * - Commit all staged rows in one storage transaction
 * - Reconcile uniqueness conflicts raised by concurrent ingestion at commit time
 */
@Service
@Slf4j
public class TransactionLoader {

    private final TransactionRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Validator validator;
    private final ObjectMapper objectMapper;

    @Value("${finpulse.ingestion.default-currency:UZS}")
    private String defaultCurrency = "UZS";

    @Value("${finpulse.ingestion.zone:UTC}")
    private String zone = "UTC";

    @Value("${finpulse.ingestion.reconcile-conflicts:true}")
    private boolean reconcileConflicts = true;

    public TransactionLoader(TransactionRepository repository,
                             PlatformTransactionManager transactionManager,
                             Validator validator,
                             ObjectMapper objectMapper) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.validator = validator;
        this.objectMapper = objectMapper;
    }

    /**
     * Loads a batch of transactions.
     *
     * @param transactions fingerprinted transactions, in input order
     * @param ownerId      owning user
     * @param accountId    owning account, may be null
     * @return counts of saved and duplicate rows plus per-row errors (1-based positions)
     * @throws CommitFailureException if the final commit fails; nothing is saved in that case
     */
    public LoadResult load(List<CanonicalTransaction> transactions, long ownerId, Long accountId) {
        if (transactions == null || transactions.isEmpty()) {
            return LoadResult.empty();
        }

        Instant ingestedAt = Instant.now();
        ZoneId zoneId = ZoneId.of(zone);
        List<RowOutcome> outcomes = new ArrayList<>(transactions.size());
        List<StagedRow> staged = new ArrayList<>();
        Set<String> batchHashes = new HashSet<>();

        for (int i = 0; i < transactions.size(); i++) {
            int position = i + 1;
            CanonicalTransaction transaction = transactions.get(i);
            try {
                String hash = transaction.transactionHash();
                if (hash == null || hash.isBlank()) {
                    throw new IllegalArgumentException("transaction hash is missing");
                }
                if (batchHashes.contains(hash) || repository.existsByTransactionHash(hash)) {
                    log.debug("Row {} is a duplicate: {}", position, hash);
                    outcomes.add(new RowOutcome.Duplicate(hash));
                    continue;
                }

                TransactionEntity entity = toEntity(transaction, ownerId, accountId, ingestedAt, zoneId);
                validate(entity);

                batchHashes.add(hash);
                staged.add(new StagedRow(position, entity));
                outcomes.add(new RowOutcome.Inserted(hash));
            } catch (Exception ex) {
                log.warn("Row {} rejected: {}", position, ex.getMessage());
                outcomes.add(new RowOutcome.Failed(reasonOf(ex)));
            }
        }

        commit(staged, outcomes);

        LoadResult result = LoadResult.fold(outcomes);
        log.info("Saved {} transactions, skipped {} duplicates, {} errors",
                result.saved(), result.duplicates(), result.errors().size());
        return result;
    }

    private void commit(List<StagedRow> staged, List<RowOutcome> outcomes) {
        if (staged.isEmpty()) {
            return;
        }
        try {
            persist(staged);
        } catch (DataIntegrityViolationException ex) {
            if (!reconcileConflicts) {
                throw commitFailure(staged, ex);
            }
            log.warn("Uniqueness conflict committing {} rows, reconciling", staged.size());
            reconcile(staged, outcomes, ex);
        } catch (RuntimeException ex) {
            throw commitFailure(staged, ex);
        }
    }

    private void reconcile(List<StagedRow> staged, List<RowOutcome> outcomes, DataIntegrityViolationException conflict) {
        List<StagedRow> remaining = new ArrayList<>();
        int reclassified = 0;
        for (StagedRow row : staged) {
            String hash = row.entity().getTransactionHash();
            if (repository.existsByTransactionHash(hash)) {
                outcomes.set(row.position() - 1, new RowOutcome.Duplicate(hash));
                reclassified++;
            } else {
                remaining.add(new StagedRow(row.position(), row.entity().toBuilder().id(null).build()));
            }
        }

        // the conflict did not come from a concurrent insert of one of our fingerprints
        if (reclassified == 0) {
            throw commitFailure(staged, conflict);
        }
        log.info("Reclassified {} staged rows as duplicates after conflict", reclassified);

        if (remaining.isEmpty()) {
            return;
        }
        try {
            persist(remaining);
        } catch (RuntimeException ex) {
            throw commitFailure(remaining, ex);
        }
    }

    private void persist(List<StagedRow> rows) {
        List<TransactionEntity> entities = rows.stream().map(StagedRow::entity).toList();
        transactionTemplate.executeWithoutResult(status -> repository.saveAllAndFlush(entities));
    }

    private CommitFailureException commitFailure(List<StagedRow> rows, RuntimeException cause) {
        log.error("Commit of {} staged transactions failed, batch rolled back", rows.size(), cause);
        return new CommitFailureException(
                "Failed to commit " + rows.size() + " transactions: " + cause.getMessage(), rows.size(), cause);
    }

    private TransactionEntity toEntity(CanonicalTransaction transaction,
                                       long ownerId,
                                       Long accountId,
                                       Instant ingestedAt,
                                       ZoneId zoneId) throws JsonProcessingException {
        return TransactionEntity.builder()
                .ownerId(ownerId)
                .accountId(accountId)
                .amount(toAmount(transaction.amount()))
                .currency(defaultCurrency)
                .merchant(transaction.merchant())
                .category(transaction.category())
                .description(transaction.description())
                .externalId(transaction.externalId())
                .source(transaction.source())
                .rawPayload(serialize(transaction.rawPayload()))
                .transactionHash(transaction.transactionHash())
                .processed(false)
                .createdAt(TransactionDates.toInstant(transaction.date(), zoneId).orElse(ingestedAt))
                .ingestedAt(ingestedAt)
                .build();
    }

    private void validate(TransactionEntity entity) {
        Set<ConstraintViolation<TransactionEntity>> violations = validator.validate(entity);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining("; "));
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Amounts are taken as plain decimal numbers. Locale formatting such as
     * thousands separators or decimal commas is not cleaned and fails the row.
     */
    static BigDecimal toAmount(Object amount) {
        if (amount == null) {
            throw new IllegalArgumentException("amount is missing");
        }
        BigDecimal value;
        if (amount instanceof BigDecimal decimal) {
            value = decimal;
        } else if (amount instanceof Number number) {
            value = new BigDecimal(number.toString());
        } else {
            String text = amount.toString().trim();
            try {
                value = new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("amount '" + text + "' is not numeric", e);
            }
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private String serialize(Object rawPayload) throws JsonProcessingException {
        if (rawPayload == null) {
            return null;
        }
        if (rawPayload instanceof String text) {
            return text;
        }
        return objectMapper.writeValueAsString(rawPayload);
    }

    private static String reasonOf(Exception ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private record StagedRow(int position, TransactionEntity entity) {
    }
}
