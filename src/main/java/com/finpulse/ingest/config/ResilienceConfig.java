package com.finpulse.ingest.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j guards for upstream transaction APIs.
 * No retry instance: callers re-invoke API ingestion themselves.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String UPSTREAM_API_INSTANCE = "upstreamApi";

    @Bean
    public CircuitBreaker upstreamCircuitBreaker(CircuitBreakerRegistry circuitBreakerRegistry) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(UPSTREAM_API_INSTANCE);

        circuitBreaker.getEventPublisher()
                .onError(event -> log.warn("Circuit breaker error: {}", event))
                .onStateTransition(event -> log.warn("Circuit breaker state transition: {} -> {}",
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState()))
                .onCallNotPermitted(event -> log.warn("Circuit breaker rejected call: {}", event))
                .onFailureRateExceeded(event -> log.error("Circuit breaker failure rate exceeded: {}", event));

        return circuitBreaker;
    }

    /**
     * Caps concurrent pulls so a burst of API ingestions cannot exhaust the connection pool.
     */
    @Bean
    public Bulkhead upstreamBulkhead(BulkheadRegistry bulkheadRegistry) {
        Bulkhead bulkhead = bulkheadRegistry.bulkhead(UPSTREAM_API_INSTANCE);

        bulkhead.getEventPublisher()
                .onCallRejected(event -> log.warn("Bulkhead call rejected: available={}/{}",
                        bulkhead.getMetrics().getAvailableConcurrentCalls(),
                        bulkhead.getMetrics().getMaxAllowedConcurrentCalls()))
                .onCallFinished(event -> log.debug("Bulkhead call finished: {}", event));

        return bulkhead;
    }
}
