package com.fleetinsight.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface AnalyticsMetricRepository extends MongoRepository<AnalyticsMetric, String> {

    Optional<AnalyticsMetric> findByMetricName(String metricName);
}
