package com.fleetinsight.enrichment.oracle;

import lombok.Getter;

import java.util.Optional;

/**
 * Result of asking the oracle about one record: either an answer (structured or wrapped free text) or
 * the reason the call failed. The enrichment engine falls back to rule labels on failure.
 */
@Getter
public class OracleOutcome {

    private final OracleAnswer answer;
    private final String failureReason;

    private OracleOutcome(OracleAnswer answer, String failureReason) {
        this.answer = answer;
        this.failureReason = failureReason;
    }

    public static OracleOutcome classified(OracleAnswer answer) {
        if (answer == null) {
            throw new IllegalArgumentException("answer must not be null");
        }
        return new OracleOutcome(answer, null);
    }

    public static OracleOutcome failed(String reason) {
        return new OracleOutcome(null, reason != null ? reason : "unknown error");
    }

    public boolean isFailed() {
        return answer == null;
    }

    public Optional<OracleAnswer> getAnswer() {
        return Optional.ofNullable(answer);
    }
}
