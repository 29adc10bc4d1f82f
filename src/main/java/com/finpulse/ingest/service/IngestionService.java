package com.finpulse.ingest.service;

import com.finpulse.ingest.domain.CanonicalTransaction;
import com.finpulse.ingest.domain.IngestionSummary;
import com.finpulse.ingest.domain.LoadResult;
import com.finpulse.ingest.domain.RowError;
import com.finpulse.ingest.domain.TransactionSources;
import com.finpulse.ingest.exception.UpstreamException;
import com.finpulse.ingest.service.reader.ApiTransactionFetcher;
import com.finpulse.ingest.service.reader.CsvTransactionReader;
import com.finpulse.ingest.service.reader.UzumWebhookTranslator;
import com.finpulse.ingest.util.BatchIdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry points of the ingestion pipeline.
 * Each call reads one batch from its source, canonicalizes and fingerprints
 * every record, loads the batch in a single commit and reports the counts.
 * Reader and commit failures propagate to the caller; record-level failures
 * are reported in the summary.
 */
@Service
@Slf4j
public class IngestionService {

    public static final String BATCH_ID_MDC_KEY = "ingest.batch.id";

    private final CsvTransactionReader csvReader;
    private final ApiTransactionFetcher apiFetcher;
    private final UzumWebhookTranslator webhookTranslator;
    private final Canonicalizer canonicalizer;
    private final TransactionLoader loader;
    private final BatchIdGenerator batchIdGenerator;

    public IngestionService(CsvTransactionReader csvReader,
                            ApiTransactionFetcher apiFetcher,
                            UzumWebhookTranslator webhookTranslator,
                            Canonicalizer canonicalizer,
                            TransactionLoader loader,
                            BatchIdGenerator batchIdGenerator) {
        this.csvReader = csvReader;
        this.apiFetcher = apiFetcher;
        this.webhookTranslator = webhookTranslator;
        this.canonicalizer = canonicalizer;
        this.loader = loader;
        this.batchIdGenerator = batchIdGenerator;
    }

    /**
     * Ingests an uploaded delimited-text export.
     *
     * @param content   raw file bytes
     * @param ownerId   owning user
     * @param accountId owning account, may be null
     * @param sourceTag source stored with each row, {@code csv} when null
     * @return ingestion summary
     */
    public IngestionSummary ingestFromCsv(byte[] content, long ownerId, Long accountId, String sourceTag) {
        String source = sourceTag != null ? sourceTag : TransactionSources.CSV;
        return ingest(source, () -> csvReader.read(content), ownerId, accountId);
    }

    /**
     * Pulls transactions from a third-party JSON API and ingests them.
     * Blocks until the upstream call completes or times out.
     *
     * @param url       absolute endpoint URL
     * @param headers   request headers, may be null
     * @param params    query parameters, may be null
     * @param ownerId   owning user
     * @param accountId owning account, may be null
     * @param sourceTag source stored with each row, {@code api} when null
     * @return ingestion summary
     */
    public IngestionSummary ingestFromApi(String url,
                                          Map<String, String> headers,
                                          Map<String, ?> params,
                                          long ownerId,
                                          Long accountId,
                                          String sourceTag) {
        String source = sourceTag != null ? sourceTag : TransactionSources.API;
        return ingest(source, () -> fetchBlocking(url, headers, params), ownerId, accountId);
    }

    /**
     * Ingests a single Uzum Bank webhook callback. Redelivered callbacks are
     * reported as duplicates.
     */
    public IngestionSummary ingestFromWebhook(Map<String, Object> payload,
                                              String eventType,
                                              long ownerId,
                                              Long accountId) {
        return ingest(TransactionSources.UZUM_WEBHOOK,
                () -> List.of(webhookTranslator.translate(payload, eventType)),
                ownerId, accountId);
    }

    private List<Map<String, Object>> fetchBlocking(String url, Map<String, String> headers, Map<String, ?> params) {
        List<Map<String, Object>> records = apiFetcher.fetch(url, headers, params).block();
        if (records == null) {
            throw new UpstreamException("Upstream API returned no result");
        }
        return records;
    }

    private IngestionSummary ingest(String source,
                                    Supplier<List<Map<String, Object>>> reader,
                                    long ownerId,
                                    Long accountId) {
        String batchId = batchIdGenerator.generate();
        MDC.put(BATCH_ID_MDC_KEY, batchId);
        try {
            log.info("Starting {} ingestion for owner {}", source, ownerId);
            List<Map<String, Object>> records = reader.get();

            List<CanonicalTransaction> canonical = new ArrayList<>(records.size());
            List<Integer> inputPositions = new ArrayList<>(records.size());
            List<RowError> errors = new ArrayList<>();

            for (int i = 0; i < records.size(); i++) {
                int position = i + 1;
                try {
                    canonical.add(canonicalizer.canonicalize(records.get(i), source));
                    inputPositions.add(position);
                } catch (RuntimeException ex) {
                    log.warn("Row {} could not be canonicalized: {}", position, ex.getMessage());
                    errors.add(new RowError(position, String.valueOf(ex.getMessage())));
                }
            }

            LoadResult result = loader.load(canonical, ownerId, accountId);
            for (RowError error : result.errors()) {
                errors.add(new RowError(inputPositions.get(error.position() - 1), error.message()));
            }
            errors.sort(Comparator.comparingInt(RowError::position));

            IngestionSummary summary = new IngestionSummary(
                    batchId, records.size(), result.saved(), result.duplicates(), errors);
            log.info("Completed {} ingestion: total={}, saved={}, duplicates={}, errors={}",
                    source, summary.total(), summary.saved(), summary.duplicates(), errors.size());
            return summary;

        } catch (RuntimeException ex) {
            log.error("{} ingestion failed: {}", source, ex.getMessage());
            throw ex;
        } finally {
            MDC.remove(BATCH_ID_MDC_KEY);
        }
    }
}
