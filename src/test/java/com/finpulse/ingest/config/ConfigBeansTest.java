package com.finpulse.ingest.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Configuration beans")
class ConfigBeansTest {

    @Test
    @DisplayName("Should register resilience instances under the upstream API name")
    void shouldRegisterResilienceInstances() {
        ResilienceConfig config = new ResilienceConfig();
        CircuitBreakerRegistry circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        BulkheadRegistry bulkheadRegistry = BulkheadRegistry.ofDefaults();

        CircuitBreaker circuitBreaker = config.upstreamCircuitBreaker(circuitBreakerRegistry);
        Bulkhead bulkhead = config.upstreamBulkhead(bulkheadRegistry);

        assertThat(circuitBreaker.getName()).isEqualTo("upstreamApi");
        assertThat(circuitBreakerRegistry.find("upstreamApi")).containsSame(circuitBreaker);
        assertThat(bulkhead.getName()).isEqualTo("upstreamApi");
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("Should build the upstream WebClient from configured timeouts")
    void shouldBuildWebClient() {
        WebClientConfig config = new WebClientConfig();
        ReflectionTestUtils.setField(config, "connectionTimeout", 1000);
        ReflectionTestUtils.setField(config, "requestTimeout", 2000);
        ReflectionTestUtils.setField(config, "maxInMemorySize", 1024 * 1024);

        WebClient webClient = config.upstreamWebClient();

        assertThat(webClient).isNotNull();
    }

    @Test
    @DisplayName("Should default CSV charsets and tolerate missing aliases")
    void shouldDefaultIngestionProperties() {
        IngestionProperties defaults = IngestionProperties.defaults();

        assertThat(defaults.csv().primaryCharset()).isEqualTo("UTF-8");
        assertThat(defaults.csv().fallbackCharset()).isEqualTo("windows-1251");
        assertThat(defaults.aliasesFor("merchant")).isEmpty();

        IngestionProperties configured = new IngestionProperties(
                new IngestionProperties.Csv("UTF-8", "KOI8-R"),
                Map.of("amount", List.of("sum")));
        assertThat(configured.csv().fallbackCharset()).isEqualTo("KOI8-R");
        assertThat(configured.aliasesFor("amount")).containsExactly("sum");
    }
}
