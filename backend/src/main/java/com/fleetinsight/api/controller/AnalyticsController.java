package com.fleetinsight.api.controller;

import com.fleetinsight.analytics.AggregateMetrics;
import com.fleetinsight.analytics.AggregateMetricsCalculator;
import com.fleetinsight.analytics.FleetDataQueryService;
import com.fleetinsight.analytics.HeatmapType;
import com.fleetinsight.analytics.MetricsStore;
import com.fleetinsight.api.dto.DashboardResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * GET /analytics-metrics (persisted, cached) and GET /dashboard-data (computed live).
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalyticsController {

    static final int DASHBOARD_SAMPLE_SIZE = 100;

    private final MetricsStore metricsStore;
    private final AggregateMetricsCalculator aggregateMetricsCalculator;
    private final FleetDataQueryService fleetDataQueryService;

    @GetMapping("/analytics-metrics")
    public ResponseEntity<AggregateMetrics> analyticsMetrics() {
        return ResponseEntity.ok(metricsStore.latest());
    }

    @GetMapping("/dashboard-data")
    public ResponseEntity<DashboardResponse> dashboardData() {
        Map<String, List<double[]>> heatmaps = new LinkedHashMap<>();
        for (HeatmapType type : HeatmapType.values()) {
            heatmaps.put(type.name().toLowerCase(Locale.ROOT), fleetDataQueryService.heatmap(type));
        }
        return ResponseEntity.ok(new DashboardResponse(
                aggregateMetricsCalculator.computeAggregates(),
                heatmaps,
                new DashboardResponse.SampleData(
                        fleetDataQueryService.gpsPoints(DASHBOARD_SAMPLE_SIZE, null),
                        fleetDataQueryService.trips(DASHBOARD_SAMPLE_SIZE, null))));
    }
}
