package com.fleetinsight.api.dto;

import com.fleetinsight.analytics.AggregateMetrics;
import com.fleetinsight.domain.EnrichedGpsPoint;
import com.fleetinsight.domain.EnrichedTripRecord;

import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/dashboard-data response: live aggregates, the three heatmaps keyed by type, and samples.
 */
public record DashboardResponse(
        AggregateMetrics metrics,
        Map<String, List<double[]>> heatmapData,
        SampleData sampleData
) {

    public record SampleData(List<EnrichedGpsPoint> gps, List<EnrichedTripRecord> taxi) {
    }
}
