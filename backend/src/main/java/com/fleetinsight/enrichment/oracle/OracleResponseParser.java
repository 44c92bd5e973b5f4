package com.fleetinsight.enrichment.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns the oracle's text answer into an {@link OracleAnswer}. Never throws: anything that is not a JSON
 * object is wrapped as free-text insights with the default confidence and a timestamp.
 */
@Component
@RequiredArgsConstructor
public class OracleResponseParser {

    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OracleAnswer parse(String text) {
        Optional<ObjectNode> structured = readObject(text);
        if (structured.isPresent()) {
            return OracleAnswer.structured(structured.get());
        }
        ObjectNode wrapper = objectMapper.createObjectNode();
        wrapper.put(OracleAnswer.INSIGHTS, text != null ? text : "");
        wrapper.put(OracleAnswer.CONFIDENCE, OracleAnswer.DEFAULT_CONFIDENCE);
        wrapper.put(OracleAnswer.PROCESSED_AT, Instant.now(clock).toString());
        return OracleAnswer.unstructured(wrapper);
    }

    private Optional<ObjectNode> readObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(stripCodeFence(text));
            return root != null && root.isObject() ? Optional.of((ObjectNode) root) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /** Chat models often wrap JSON in a markdown fence (```json ... ```). */
    static String stripCodeFence(String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith(FENCE) || !trimmed.endsWith(FENCE) || trimmed.length() < 2 * FENCE.length()) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        if (firstNewline < 0) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, trimmed.length() - FENCE.length()).strip();
    }
}
