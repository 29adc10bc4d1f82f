package com.finpulse.ingest.service.reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finpulse.ingest.exception.UnexpectedShapeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApiResponseNormalizer Unit Tests")
class ApiResponseNormalizerTest {

    private static final String RECORDS = """
            [{"id": "t-1", "amount": -45000.5, "merchant": "Korzinka"},
             {"id": "t-2", "amount": 1200000, "merchant": "Employer"}]
            """;

    private ObjectMapper objectMapper;
    private ApiResponseNormalizer normalizer;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        normalizer = new ApiResponseNormalizer(objectMapper);
    }

    @Test
    @DisplayName("Should normalize bare list, transactions wrapper and result wrapper identically")
    void shouldNormalizeSupportedShapesIdentically() throws JsonProcessingException {
        List<Map<String, Object>> bare = normalizer.normalize(json(RECORDS));
        List<Map<String, Object>> wrapped = normalizer.normalize(json("{\"transactions\": " + RECORDS + "}"));
        List<Map<String, Object>> nested = normalizer.normalize(
                json("{\"result\": {\"transactions\": " + RECORDS + "}}"));
        List<Map<String, Object>> data = normalizer.normalize(json("{\"data\": " + RECORDS + "}"));

        assertThat(bare).hasSize(2);
        assertThat(wrapped).isEqualTo(bare);
        assertThat(nested).isEqualTo(bare);
        assertThat(data).isEqualTo(bare);
        assertThat(bare.get(0)).containsEntry("id", "t-1").containsEntry("merchant", "Korzinka");
    }

    @Test
    @DisplayName("Should return no records for an object without a known wrapper")
    void shouldReturnEmptyForUnknownObject() throws JsonProcessingException {
        assertThat(normalizer.normalize(json("{\"foo\": \"bar\"}"))).isEmpty();
    }

    @Test
    @DisplayName("Should skip empty candidates and use the next wrapper")
    void shouldSkipEmptyCandidates() throws JsonProcessingException {
        List<Map<String, Object>> records = normalizer.normalize(
                json("{\"data\": [], \"transactions\": null, \"result\": {\"transactions\": " + RECORDS + "}}"));

        assertThat(records).hasSize(2);
    }

    @ParameterizedTest
    @ValueSource(strings = {"42", "\"text\"", "true"})
    @DisplayName("Should reject scalar bodies")
    void shouldRejectScalars(String body) throws JsonProcessingException {
        JsonNode node = json(body);

        assertThatThrownBy(() -> normalizer.normalize(node))
                .isInstanceOf(UnexpectedShapeException.class);
    }

    @Test
    @DisplayName("Should reject a wrapper that is not an array")
    void shouldRejectNonArrayWrapper() throws JsonProcessingException {
        JsonNode node = json("{\"transactions\": {\"id\": \"t-1\"}}");

        assertThatThrownBy(() -> normalizer.normalize(node))
                .isInstanceOf(UnexpectedShapeException.class)
                .hasMessageContaining("/transactions");
    }

    @Test
    @DisplayName("Should reject array elements that are not objects")
    void shouldRejectNonObjectElements() throws JsonProcessingException {
        JsonNode node = json("[{\"id\": \"t-1\"}, 7]");

        assertThatThrownBy(() -> normalizer.normalize(node))
                .isInstanceOf(UnexpectedShapeException.class)
                .hasMessageContaining("Record 2");
    }

    private JsonNode json(String body) throws JsonProcessingException {
        return objectMapper.readTree(body);
    }
}
