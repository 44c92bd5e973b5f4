package com.fleetinsight.enrichment.oracle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Asks the oracle about one record and turns whatever happens into an {@link OracleOutcome}.
 * A failed call (timeout, transport, rate limit, any runtime error) becomes {@code failed(reason)};
 * an answer that is not JSON becomes a wrapped free-text answer.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OracleClassifier {

    private final InsightOracle insightOracle;
    private final OracleResponseParser oracleResponseParser;

    public OracleOutcome ask(String prompt) {
        String text;
        try {
            text = insightOracle.complete(prompt);
        } catch (Exception e) {
            log.warn("Oracle call failed, using rule-based labels: {}", e.toString());
            return OracleOutcome.failed(reasonOf(e));
        }
        return OracleOutcome.classified(oracleResponseParser.parse(text));
    }

    private static String reasonOf(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
