package com.fleetinsight.analytics;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fleetinsight.domain.MetricKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Metric name → {@link MetricValue}, in insertion order. Serialises as the plain map.
 */
public final class AggregateMetrics {

    public static final String GPS_POINTS_COUNT = "gps_points_count";
    public static final String AVG_SPEED_MPS = "avg_speed_mps";
    public static final String AVG_SPEED_KMH = "avg_speed_kmh";
    public static final String TAXI_TRIPS_COUNT = "taxi_trips_count";
    public static final String AVG_FARE_USD = "avg_fare_usd";
    public static final String AVG_FARE_TENGE = "avg_fare_tenge";
    public static final String AVG_TRIP_DURATION_MIN = "avg_trip_duration_min";
    public static final String AVG_DISTANCE_KM = "avg_distance_km";
    public static final String SURGE_PERCENTAGE = "surge_percentage";
    public static final String PRICE_PER_KM_TENGE = "price_per_km_tenge";

    private final Map<String, MetricValue> metrics;

    public AggregateMetrics(Map<String, MetricValue> metrics) {
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static Builder builder(Instant calculatedAt) {
        return new Builder(calculatedAt);
    }

    @JsonValue
    public Map<String, MetricValue> asMap() {
        return metrics;
    }

    public Optional<MetricValue> get(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    /** Value of a metric, 0 when absent. */
    public double valueOf(String name) {
        MetricValue metric = metrics.get(name);
        return metric != null ? metric.value() : 0.0;
    }

    public int size() {
        return metrics.size();
    }

    public static final class Builder {

        private final Instant calculatedAt;
        private final Map<String, MetricValue> metrics = new LinkedHashMap<>();

        private Builder(Instant calculatedAt) {
            this.calculatedAt = calculatedAt;
        }

        public Builder put(String name, double value, MetricKind kind, String description) {
            metrics.put(name, new MetricValue(value, kind, description, calculatedAt));
            return this;
        }

        public AggregateMetrics build() {
            return new AggregateMetrics(metrics);
        }
    }
}
