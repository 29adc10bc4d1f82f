package com.finpulse.ingest.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UpstreamException Unit Tests")
class UpstreamExceptionTest {

    @Test
    @DisplayName("Should store status code")
    void shouldStoreStatusCode() {
        UpstreamException ex = new UpstreamException("error", 503);
        assertThat(ex.getStatusCode()).isEqualTo(503);
    }

    @Test
    @DisplayName("Should default to zero status code for transport failures")
    void shouldDefaultToZeroStatusCode() {
        IOException cause = new IOException("connection refused");
        UpstreamException ex = new UpstreamException("error", cause);
        assertThat(ex.getStatusCode()).isZero();
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    @DisplayName("Should be an IngestionException")
    void shouldBeIngestionException() {
        assertThat(new UpstreamException("error")).isInstanceOf(IngestionException.class);
    }

    @Test
    @DisplayName("Should include message and status code in toString")
    void shouldIncludeFieldsInToString() {
        UpstreamException ex = new UpstreamException("service error", 502);
        String str = ex.toString();
        assertThat(str).contains("service error");
        assertThat(str).contains("502");
    }
}
