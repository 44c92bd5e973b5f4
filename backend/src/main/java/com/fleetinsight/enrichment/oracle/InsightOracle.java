package com.fleetinsight.enrichment.oracle;

/**
 * External inference service. Given a prompt describing one record, returns the model's raw text answer.
 * Implementations block until the answer arrives and throw on transport failure or timeout.
 */
public interface InsightOracle {

    String complete(String prompt);

    /** False when the oracle has no credentials and every call would fail. */
    boolean isConfigured();
}
