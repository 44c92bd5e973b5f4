package com.fleetinsight.analytics;

import com.fleetinsight.domain.MetricKind;

import java.time.Instant;

/**
 * One named aggregate: value, kind, description and when it was computed.
 */
public record MetricValue(double value, MetricKind kind, String description, Instant calculatedAt) {
}
