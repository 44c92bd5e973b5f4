package com.fleetinsight.enrichment.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Parsed oracle answer. Structured when the answer was a JSON object; otherwise a wrapper holding the raw
 * text as insights with the default confidence.
 */
public final class OracleAnswer {

    public static final double DEFAULT_CONFIDENCE = 0.7;

    public static final String INSIGHTS = "insights";
    public static final String CONFIDENCE = "confidence";
    public static final String PROCESSED_AT = "processed_at";

    private final ObjectNode fields;
    private final boolean structured;

    private OracleAnswer(ObjectNode fields, boolean structured) {
        this.fields = fields;
        this.structured = structured;
    }

    static OracleAnswer structured(ObjectNode fields) {
        return new OracleAnswer(fields, true);
    }

    static OracleAnswer unstructured(ObjectNode wrapper) {
        return new OracleAnswer(wrapper, false);
    }

    public boolean isStructured() {
        return structured;
    }

    /** Text value of a key; numbers and booleans are rendered as text. Empty for missing, null or container values. */
    public Optional<String> text(String key) {
        JsonNode node = fields.get(key);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    /** Numeric value of a key; numeric strings such as "0.8" are accepted. */
    public Optional<Double> number(String key) {
        JsonNode node = fields.get(key);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.doubleValue());
        }
        if (node.isTextual()) {
            try {
                return Optional.of(Double.parseDouble(node.asText().strip()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Insights as stored on the enriched record: plain text as is, objects and arrays as their JSON text.
     */
    public Optional<String> insights() {
        JsonNode node = fields.get(INSIGHTS);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(node.isContainerNode() ? node.toString() : node.asText());
    }

    public Optional<Double> confidence() {
        return number(CONFIDENCE);
    }
}
