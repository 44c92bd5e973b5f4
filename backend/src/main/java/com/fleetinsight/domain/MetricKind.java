package com.fleetinsight.domain;

public enum MetricKind {
    GPS,
    TAXI,
    CALCULATED
}
