package com.finpulse.ingest.service;

import com.finpulse.ingest.domain.TransactionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Spring Data JPA repository for ingested transactions.
 * The unique constraint on {@code transaction_hash} is the final guard against duplicates.
 */
@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    /**
     * Checks whether a transaction with the given fingerprint is already stored.
     *
     * @param transactionHash SHA-256 fingerprint
     * @return true if a row with that fingerprint exists
     */
    boolean existsByTransactionHash(String transactionHash);
}
