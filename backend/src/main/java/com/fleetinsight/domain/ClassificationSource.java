package com.fleetinsight.domain;

/**
 * Where the labels of an enriched record came from.
 * ORACLE: oracle returned the structured key set.
 * ORACLE_UNSTRUCTURED: oracle answered with free text; insights hold the raw answer.
 * FALLBACK: oracle call failed; labels come from the deterministic rules.
 */
public enum ClassificationSource {
    ORACLE,
    ORACLE_UNSTRUCTURED,
    FALLBACK
}
