package com.fleetinsight.api.controller;

import com.fleetinsight.analytics.AggregateMetrics;
import com.fleetinsight.analytics.MetricsStore;
import com.fleetinsight.domain.AnalyticsMetricRepository;
import com.fleetinsight.domain.AreaLabel;
import com.fleetinsight.domain.ClassificationSource;
import com.fleetinsight.domain.EnrichedGpsPoint;
import com.fleetinsight.domain.EnrichedGpsPointRepository;
import com.fleetinsight.domain.EnrichedTripRecord;
import com.fleetinsight.domain.EnrichedTripRecordRepository;
import com.fleetinsight.domain.MetricKind;
import com.fleetinsight.domain.ProcessingRunRepository;
import com.fleetinsight.domain.TripLengthLabel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;

/**
 * HTTP API against a real MongoDB: reads, parameter validation and processing rejection.
 */
@SpringBootTest(properties = {
        "fleetinsight.oracle.api-key=",
        "fleetinsight.enrichment.gps-csv-path=missing-gps.csv",
        "fleetinsight.enrichment.taxi-csv-path=missing-taxi.csv"
})
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class FleetInsightApiIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    EnrichedGpsPointRepository gpsRepository;
    @Autowired
    EnrichedTripRecordRepository tripRepository;
    @Autowired
    AnalyticsMetricRepository analyticsMetricRepository;
    @Autowired
    ProcessingRunRepository processingRunRepository;
    @Autowired
    MetricsStore metricsStore;
    @Autowired
    CacheManager cacheManager;

    @BeforeEach
    void clean() {
        gpsRepository.deleteAll();
        tripRepository.deleteAll();
        analyticsMetricRepository.deleteAll();
        processingRunRepository.deleteAll();
        cacheManager.getCache(MetricsStore.METRICS_CACHE).clear();
    }

    private static EnrichedGpsPoint gps(String id, double lat, double speed, AreaLabel area) {
        return EnrichedGpsPoint.builder()
                .originalId(id).latitude(lat).longitude(71.43).altitude(350).speed(speed)
                .areaLabel(area).classificationSource(ClassificationSource.FALLBACK)
                .processedAt(Instant.now())
                .build();
    }

    @Test
    @DisplayName("GET /health reports the oracle as not configured")
    void health() {
        webTestClient.get().uri("/api/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.oracleConfigured").isEqualTo(false);
    }

    @Test
    @DisplayName("POST /process-data without API key returns 400 ORACLE_NOT_CONFIGURED; status stays idle")
    void processData_rejectedWithoutApiKey() {
        webTestClient.post().uri("/api/v1/process-data")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("ORACLE_NOT_CONFIGURED")
                .jsonPath("$.timestamp").exists();

        webTestClient.get().uri("/api/v1/processing-status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("idle")
                .jsonPath("$.processing").isEqualTo(false);
    }

    @Test
    @DisplayName("GET /gps-data filters by area label and rejects unknown areas and bad limits")
    void gpsData() {
        gpsRepository.saveAll(List.of(
                gps("n1", 51.15, 12, AreaLabel.NORTH),
                gps("n2", 51.16, 0, AreaLabel.NORTH),
                gps("s1", 51.05, 4, AreaLabel.SOUTH)));

        webTestClient.get().uri("/api/v1/gps-data?area=north&limit=10")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(2)
                .jsonPath("$.data[0].areaLabel").isEqualTo("North");

        webTestClient.get().uri("/api/v1/gps-data?area=West")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_AREA");

        webTestClient.get().uri("/api/v1/gps-data?limit=0")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_LIMIT");
    }

    @Test
    @DisplayName("GET /heatmap-data returns moving points for speed and rejects unknown types")
    void heatmapData() {
        gpsRepository.saveAll(List.of(
                gps("a", 51.15, 12, AreaLabel.NORTH),
                gps("b", 51.10, 0, AreaLabel.CENTER)));

        webTestClient.get().uri("/api/v1/heatmap-data?heatmapType=speed")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(1)
                .jsonPath("$.data[0][2]").isEqualTo(12.0);

        webTestClient.get().uri("/api/v1/heatmap-data?heatmapType=traffic")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_HEATMAP_TYPE");
    }

    @Test
    @DisplayName("GET /trip-analysis groups trips by Short, Medium, Long")
    void tripAnalysis() {
        tripRepository.save(EnrichedTripRecord.builder()
                .durationMin(45).distanceKm(20).fare(15).tripLengthLabel(TripLengthLabel.LONG)
                .classificationSource(ClassificationSource.FALLBACK).build());

        webTestClient.get().uri("/api/v1/trip-analysis")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.Short").isEmpty()
                .jsonPath("$.Long.length()").isEqualTo(1)
                .jsonPath("$.Long[0].tripLengthLabel").isEqualTo("Long");
    }

    @Test
    @DisplayName("GET /analytics-metrics returns the stored metrics keyed by name")
    void analyticsMetrics() {
        metricsStore.saveMetrics(AggregateMetrics.builder(Instant.parse("2024-05-01T10:00:00Z"))
                .put(AggregateMetrics.AVG_FARE_USD, 4.5, MetricKind.TAXI, "Average fare, USD")
                .build());

        webTestClient.get().uri("/api/v1/analytics-metrics")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.avg_fare_usd.value").isEqualTo(4.5)
                .jsonPath("$.avg_fare_usd.kind").isEqualTo("TAXI");
    }

    @Test
    @DisplayName("GET /dashboard-data over an empty corpus returns zero metrics and empty heatmaps")
    void dashboardData_empty() {
        webTestClient.get().uri("/api/v1/dashboard-data")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.metrics.taxi_trips_count.value").isEqualTo(0.0)
                .jsonPath("$.heatmapData.density").isEmpty()
                .jsonPath("$.sampleData.gps").isEmpty();
    }
}
