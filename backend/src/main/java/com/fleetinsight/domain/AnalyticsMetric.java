package com.fleetinsight.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Latest value of one aggregate metric. One document per metric name; each aggregation run overwrites it.
 */
@Document(collection = "analytics_metrics")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AnalyticsMetric {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String metricName;
    private double metricValue;
    private MetricKind metricKind;
    private String description;
    private Instant calculatedAt;
}
