package com.finpulse.ingest.service.reader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finpulse.ingest.exception.UnexpectedShapeException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts the list of transaction records from an API response body.
 * <p>
 * Accepts a bare JSON array, or an object wrapping the array under
 * {@code data}, {@code transactions} or {@code result.transactions}
 * (tried in that order; missing, null or empty candidates are skipped).
 * An object without any of them yields no records.
 */
@Component
public class ApiResponseNormalizer {

    private static final List<String> RECORD_POINTERS = List.of("/data", "/transactions", "/result/transactions");

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ApiResponseNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Map<String, Object>> normalize(JsonNode body) {
        if (body == null || body.isMissingNode() || body.isNull()) {
            throw new UnexpectedShapeException("API response body is empty");
        }
        if (body.isArray()) {
            return toRecords(body, "$");
        }
        if (body.isObject()) {
            for (String pointer : RECORD_POINTERS) {
                JsonNode candidate = body.at(pointer);
                if (isAbsent(candidate)) {
                    continue;
                }
                if (!candidate.isArray()) {
                    throw new UnexpectedShapeException(
                            "Expected an array at " + pointer + " but found " + candidate.getNodeType());
                }
                return toRecords(candidate, pointer);
            }
            return List.of();
        }
        throw new UnexpectedShapeException("Unexpected API response type: " + body.getNodeType());
    }

    private List<Map<String, Object>> toRecords(JsonNode array, String location) {
        List<Map<String, Object>> records = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            if (!element.isObject()) {
                throw new UnexpectedShapeException(
                        "Record " + (i + 1) + " at " + location + " is " + element.getNodeType() + ", not an object");
            }
            records.add(objectMapper.convertValue(element, RECORD_TYPE));
        }
        return records;
    }

    private static boolean isAbsent(JsonNode node) {
        return node.isMissingNode()
                || node.isNull()
                || (node.isContainerNode() && node.isEmpty())
                || (node.isTextual() && node.asText().isEmpty());
    }
}
