package com.finpulse.ingest.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for the WebClient used to pull transactions from upstream APIs.
 * The client has no base URL: every API ingestion call supplies an absolute endpoint.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Value("${finpulse.api.timeout.connection:5000}")
    private int connectionTimeout;

    @Value("${finpulse.api.timeout.request:30000}")
    private int requestTimeout;

    @Value("${finpulse.api.max-in-memory-size:16777216}")
    private int maxInMemorySize;

    /**
     * Creates the upstream WebClient.
     * - Connection pooling (max 50 connections)
     * - Connection timeout (5s default)
     * - Response/read/write timeout (30s default)
     * - Debug logging of requests and response status
     */
    @Bean
    public WebClient upstreamWebClient() {
        ConnectionProvider connectionProvider = ConnectionProvider.builder("upstream-pool")
                .maxConnections(50)
                .maxIdleTime(Duration.ofSeconds(20))
                .maxLifeTime(Duration.ofMinutes(5))
                .pendingAcquireTimeout(Duration.ofSeconds(45))
                .evictInBackground(Duration.ofSeconds(120))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectionTimeout)
                .responseTimeout(Duration.ofMillis(requestTimeout))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(requestTimeout, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(requestTimeout, TimeUnit.MILLISECONDS))
                );

        // statement exports can be large
        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(exchangeStrategies)
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    /**
     * Logs outgoing requests. Header values are omitted; upstream APIs are
     * called with bearer tokens and API keys.
     */
    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if (log.isDebugEnabled()) {
                log.debug("Request: {} {} headers={}", clientRequest.method(), clientRequest.url(),
                        clientRequest.headers().keySet());
            }
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (log.isDebugEnabled()) {
                log.debug("Response Status: {}", clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
