package com.fleetinsight.analytics;

import com.fleetinsight.domain.AnalyticsMetric;
import com.fleetinsight.domain.AnalyticsMetricRepository;
import com.fleetinsight.domain.MetricKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricsStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private AnalyticsMetricRepository repository;

    @InjectMocks
    private MetricsStore store;

    @Test
    @DisplayName("saveMetrics overwrites an existing metric document by name")
    void saveMetrics_upsertsByName() {
        AnalyticsMetric existing = new AnalyticsMetric();
        existing.setId("m1");
        existing.setMetricName(AggregateMetrics.AVG_FARE_USD);
        existing.setMetricValue(1.0);
        when(repository.findByMetricName(AggregateMetrics.AVG_FARE_USD)).thenReturn(Optional.of(existing));

        int saved = store.saveMetrics(AggregateMetrics.builder(NOW)
                .put(AggregateMetrics.AVG_FARE_USD, 4.5, MetricKind.TAXI, "Average fare, USD")
                .build());

        ArgumentCaptor<AnalyticsMetric> captor = ArgumentCaptor.forClass(AnalyticsMetric.class);
        verify(repository).save(captor.capture());
        assertThat(saved).isEqualTo(1);
        assertThat(captor.getValue().getId()).isEqualTo("m1");
        assertThat(captor.getValue().getMetricValue()).isEqualTo(4.5);
        assertThat(captor.getValue().getCalculatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("a metric that fails to save does not stop the others")
    void saveMetrics_isolatesFailures() {
        when(repository.findByMetricName(anyString())).thenReturn(Optional.empty());
        when(repository.save(any(AnalyticsMetric.class))).thenAnswer(inv -> {
            AnalyticsMetric m = inv.getArgument(0);
            if (AggregateMetrics.SURGE_PERCENTAGE.equals(m.getMetricName())) {
                throw new DataAccessResourceFailureException("write failed");
            }
            return m;
        });

        int saved = store.saveMetrics(AggregateMetrics.builder(NOW)
                .put(AggregateMetrics.GPS_POINTS_COUNT, 3, MetricKind.GPS, "count")
                .put(AggregateMetrics.SURGE_PERCENTAGE, 50, MetricKind.CALCULATED, "surge")
                .put(AggregateMetrics.TAXI_TRIPS_COUNT, 4, MetricKind.TAXI, "count")
                .build());

        assertThat(saved).isEqualTo(2);
        verify(repository, times(3)).save(any(AnalyticsMetric.class));
    }

    @Test
    @DisplayName("latest maps persisted documents to metric values")
    void latest_mapsDocuments() {
        AnalyticsMetric doc = new AnalyticsMetric();
        doc.setMetricName(AggregateMetrics.AVG_SPEED_KMH);
        doc.setMetricValue(36.0);
        doc.setMetricKind(MetricKind.CALCULATED);
        doc.setDescription("Average speed of moving GPS points, km/h");
        doc.setCalculatedAt(NOW);
        when(repository.findAll()).thenReturn(List.of(doc));

        AggregateMetrics latest = store.latest();

        assertThat(latest.size()).isEqualTo(1);
        assertThat(latest.valueOf(AggregateMetrics.AVG_SPEED_KMH)).isEqualTo(36.0);
        assertThat(latest.get(AggregateMetrics.AVG_SPEED_KMH))
                .hasValueSatisfying(m -> assertThat(m.kind()).isEqualTo(MetricKind.CALCULATED));
    }
}
