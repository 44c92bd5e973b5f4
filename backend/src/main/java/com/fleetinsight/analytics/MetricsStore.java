package com.fleetinsight.analytics;

import com.fleetinsight.domain.AnalyticsMetric;
import com.fleetinsight.domain.AnalyticsMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists aggregate metrics, one document per metric name. Saving a run overwrites the previous values;
 * there is no history.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsStore {

    /** Registered in the Caffeine cache manager. */
    public static final String METRICS_CACHE = "metricsCache";

    private final AnalyticsMetricRepository repository;

    /**
     * Upsert every metric by name. A metric that fails to save is logged and skipped.
     */
    @CacheEvict(cacheNames = METRICS_CACHE, allEntries = true)
    public int saveMetrics(AggregateMetrics metrics) {
        int saved = 0;
        for (Map.Entry<String, MetricValue> entry : metrics.asMap().entrySet()) {
            try {
                AnalyticsMetric doc = repository.findByMetricName(entry.getKey()).orElseGet(AnalyticsMetric::new);
                doc.setMetricName(entry.getKey());
                doc.setMetricValue(entry.getValue().value());
                doc.setMetricKind(entry.getValue().kind());
                doc.setDescription(entry.getValue().description());
                doc.setCalculatedAt(entry.getValue().calculatedAt());
                repository.save(doc);
                saved++;
            } catch (RuntimeException e) {
                log.error("Error saving metric {}: {}", entry.getKey(), e.getMessage(), e);
            }
        }
        return saved;
    }

    /** Latest persisted metrics. */
    @Cacheable(cacheNames = METRICS_CACHE, key = "'latest'")
    public AggregateMetrics latest() {
        Map<String, MetricValue> metrics = new LinkedHashMap<>();
        for (AnalyticsMetric doc : repository.findAll()) {
            metrics.put(doc.getMetricName(), new MetricValue(
                    doc.getMetricValue(), doc.getMetricKind(), doc.getDescription(), doc.getCalculatedAt()));
        }
        return new AggregateMetrics(metrics);
    }
}
