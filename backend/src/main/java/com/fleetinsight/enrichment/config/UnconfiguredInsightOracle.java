package com.fleetinsight.enrichment.config;

import com.fleetinsight.enrichment.oracle.InsightOracle;

/**
 * Stand-in when no API key is set: every call fails, so every record gets rule-based labels.
 */
class UnconfiguredInsightOracle implements InsightOracle {

    @Override
    public String complete(String prompt) {
        throw new IllegalStateException("Oracle API key not configured");
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
