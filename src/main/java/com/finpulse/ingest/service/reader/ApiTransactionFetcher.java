package com.finpulse.ingest.service.reader;

import com.fasterxml.jackson.databind.JsonNode;
import com.finpulse.ingest.exception.IngestionException;
import com.finpulse.ingest.exception.UnexpectedShapeException;
import com.finpulse.ingest.exception.UpstreamException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Pulls transaction records from a third-party JSON API.
 * Features:
 * - One GET per call, bounded by the request timeout (30s default)
 * - Circuit breaker and bulkhead around the upstream call
 * - Response shape normalization via {@link ApiResponseNormalizer}
 * - Failures mapped to {@link UpstreamException} / {@link UnexpectedShapeException}
 */
@Service
@Slf4j
public class ApiTransactionFetcher {

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final Bulkhead bulkhead;
    private final ApiResponseNormalizer normalizer;

    @Value("${finpulse.api.timeout.request:30000}")
    private long requestTimeoutMillis = 30000;

    public ApiTransactionFetcher(WebClient upstreamWebClient,
                                 CircuitBreaker upstreamCircuitBreaker,
                                 Bulkhead upstreamBulkhead,
                                 ApiResponseNormalizer normalizer) {
        this.webClient = upstreamWebClient;
        this.circuitBreaker = upstreamCircuitBreaker;
        this.bulkhead = upstreamBulkhead;
        this.normalizer = normalizer;
    }

    /**
     * Fetches and normalizes records from the given endpoint.
     *
     * @param url     absolute endpoint URL
     * @param headers request headers (authorization etc.), may be null
     * @param params  query parameters appended to the URL, may be null
     * @return Mono with the raw records, in response order
     */
    public Mono<List<Map<String, Object>>> fetch(String url,
                                                 Map<String, String> headers,
                                                 Map<String, ?> params) {
        URI uri;
        try {
            uri = buildUri(url, params);
        } catch (IllegalArgumentException ex) {
            log.error("Rejected upstream API URL: {}", ex.getMessage());
            return Mono.error(new UpstreamException("Invalid upstream API URL", ex));
        }
        log.info("Fetching transactions from {}{}", uri.getHost(), uri.getPath());

        return webClient
                .get()
                .uri(uri)
                .headers(httpHeaders -> {
                    if (headers != null) {
                        headers.forEach(httpHeaders::set);
                    }
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), response ->
                        response.bodyToMono(String.class).defaultIfEmpty("").flatMap(body -> {
                            log.error("Upstream API error: status={}, body={}", response.statusCode(), abbreviate(body));
                            return Mono.error(statusError(response.statusCode()));
                        }))
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofMillis(requestTimeoutMillis))
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .transformDeferred(BulkheadOperator.of(bulkhead))
                .onErrorMap(this::mapToIngestionException)
                .switchIfEmpty(Mono.error(() -> new UnexpectedShapeException("API response body is empty")))
                .map(normalizer::normalize)
                .doOnSuccess(records -> log.info("Fetched {} records from {}", records.size(), uri.getHost()))
                .doOnError(error -> log.error("Error fetching transactions from {}: {}", uri.getHost(), error.getMessage()));
    }

    /**
     * The caller's URL is sent as given when it is already percent-encoded
     * (signed URLs, paging tokens) and encoded otherwise. Only the added query
     * parameters are always encoded.
     */
    private URI buildUri(String url, Map<String, ?> params) {
        URI base = parseUrl(url);
        String scheme = base.getScheme();
        if (base.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new IllegalArgumentException("Not an absolute http(s) URL");
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromUri(base);
        if (params != null) {
            params.forEach((name, value) -> builder.queryParam(
                    UriUtils.encode(name, StandardCharsets.UTF_8),
                    UriUtils.encode(String.valueOf(value), StandardCharsets.UTF_8)));
        }
        return builder.build(true).toUri();
    }

    private static URI parseUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL is empty");
        }
        try {
            return new URI(url);
        } catch (URISyntaxException notEncoded) {
            return UriComponentsBuilder.fromUriString(url).encode().build().toUri();
        }
    }

    private UpstreamException statusError(HttpStatusCode status) {
        return new UpstreamException("Upstream API responded with status " + status.value(), status.value());
    }

    private Throwable mapToIngestionException(Throwable ex) {
        if (ex instanceof IngestionException) {
            return ex;
        }
        if (ex instanceof WebClientResponseException responseException) {
            return new UpstreamException("Upstream API error: " + responseException.getMessage(),
                    responseException.getStatusCode().value(), responseException);
        }
        if (ex instanceof TimeoutException) {
            return new UpstreamException("Upstream API did not respond within " + requestTimeoutMillis + "ms", ex);
        }
        if (ex instanceof CallNotPermittedException || ex instanceof BulkheadFullException) {
            return new UpstreamException("Upstream API call rejected: " + ex.getMessage(), ex);
        }
        if (ex instanceof DecodingException) {
            return new UnexpectedShapeException("API response body is not valid JSON", ex);
        }
        return new UpstreamException("Unexpected error calling upstream API", ex);
    }

    private static String abbreviate(String body) {
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
