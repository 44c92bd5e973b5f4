package com.fleetinsight.enrichment.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class OracleResponseParserTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final OracleResponseParser parser =
            new OracleResponseParser(new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("JSON object answer is structured and exposes its keys")
    void parse_jsonObject() {
        OracleAnswer answer = parser.parse("""
                {"area_classification":"North","activity_level":"High","insights":"busy road","confidence":"0.9"}
                """);

        assertThat(answer.isStructured()).isTrue();
        assertThat(answer.text("area_classification")).contains("North");
        assertThat(answer.insights()).contains("busy road");
        assertThat(answer.confidence()).contains(0.9);
    }

    @Test
    @DisplayName("fenced JSON is unwrapped before parsing")
    void parse_fencedJson() {
        OracleAnswer answer = parser.parse("```json\n{\"trip_category\":\"Short\"}\n```");

        assertThat(answer.isStructured()).isTrue();
        assertThat(answer.text("trip_category")).contains("Short");
    }

    @Test
    @DisplayName("free text is wrapped with default confidence and timestamp, text recoverable from insights")
    void parse_freeText() {
        OracleAnswer answer = parser.parse("The point is on a busy highway.");

        assertThat(answer.isStructured()).isFalse();
        assertThat(answer.insights()).contains("The point is on a busy highway.");
        assertThat(answer.confidence()).contains(OracleAnswer.DEFAULT_CONFIDENCE);
        assertThat(answer.text(OracleAnswer.PROCESSED_AT)).contains(NOW.toString());
    }

    @Test
    @DisplayName("JSON object followed by free text is wrapped whole so the trailing text is not lost")
    void parse_jsonWithTrailingText() {
        String text = "{\"area_classification\":\"North\"} Note: the rider was late.";

        OracleAnswer answer = parser.parse(text);

        assertThat(answer.isStructured()).isFalse();
        assertThat(answer.insights()).contains(text);
        assertThat(answer.confidence()).contains(OracleAnswer.DEFAULT_CONFIDENCE);
    }

    @Test
    @DisplayName("JSON arrays and scalars are not structured answers")
    void parse_nonObjectJson() {
        assertThat(parser.parse("[1,2,3]").isStructured()).isFalse();
        assertThat(parser.parse("42").isStructured()).isFalse();
        assertThat(parser.parse(null).insights()).contains("");
    }

    @Test
    @DisplayName("object-valued insights are kept as JSON text")
    void insights_objectRenderedAsJson() {
        OracleAnswer answer = parser.parse("{\"insights\":{\"pattern\":\"rush hour\"}}");

        assertThat(answer.insights()).contains("{\"pattern\":\"rush hour\"}");
    }

    @Test
    @DisplayName("stripCodeFence leaves unfenced text alone")
    void stripCodeFence_noFence() {
        assertThat(OracleResponseParser.stripCodeFence("  {\"a\":1} ")).isEqualTo("{\"a\":1}");
        assertThat(OracleResponseParser.stripCodeFence("```\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
    }
}
