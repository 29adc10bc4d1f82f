package com.finpulse.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the Fin-Pulse ingestion service.
 *
 * Ingestion core featuring:
 * - CSV, JSON API and bank webhook source readers
 * - Canonicalization of heterogeneous field vocabularies
 * - SHA-256 content fingerprints for deduplication
 * - Batch loading with per-row error isolation and one commit per batch
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableJpaRepositories
@EnableTransactionManagement
public class IngestServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestServiceApplication.class, args);
    }
}
