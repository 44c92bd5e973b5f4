package com.fleetinsight.api.controller;

import com.fleetinsight.analytics.FleetDataQueryService;
import com.fleetinsight.analytics.HeatmapType;
import com.fleetinsight.api.dto.DataListResponse;
import com.fleetinsight.api.dto.ErrorBody;
import com.fleetinsight.api.validation.QueryParamValidator;
import com.fleetinsight.domain.AreaLabel;
import com.fleetinsight.domain.EnrichedGpsPoint;
import com.fleetinsight.domain.EnrichedTripRecord;
import com.fleetinsight.domain.TripLengthLabel;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Enriched record reads: GET /gps-data, /taxi-data, /heatmap-data, /area-analysis, /trip-analysis.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class FleetDataController {

    private final FleetDataQueryService fleetDataQueryService;
    private final QueryParamValidator queryParamValidator;

    @GetMapping("/gps-data")
    public ResponseEntity<?> gpsData(@RequestParam(defaultValue = "1000") int limit,
                                     @RequestParam(required = false) String area) {
        if (!queryParamValidator.isValidLimit(limit)) {
            return invalidLimit();
        }
        AreaLabel areaLabel = null;
        if (area != null && !area.isBlank()) {
            Optional<AreaLabel> parsed = AreaLabel.fromLabel(area);
            if (parsed.isEmpty()) {
                return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_AREA", "Unknown area: " + area));
            }
            areaLabel = parsed.get();
        }
        return ResponseEntity.ok(DataListResponse.of(fleetDataQueryService.gpsPoints(limit, areaLabel)));
    }

    @GetMapping("/taxi-data")
    public ResponseEntity<?> taxiData(@RequestParam(defaultValue = "1000") int limit,
                                      @RequestParam(required = false) String tripCategory) {
        if (!queryParamValidator.isValidLimit(limit)) {
            return invalidLimit();
        }
        TripLengthLabel category = null;
        if (tripCategory != null && !tripCategory.isBlank()) {
            Optional<TripLengthLabel> parsed = TripLengthLabel.fromLabel(tripCategory);
            if (parsed.isEmpty()) {
                return ResponseEntity.badRequest().body(
                        ErrorBody.of("INVALID_TRIP_CATEGORY", "Unknown trip category: " + tripCategory));
            }
            category = parsed.get();
        }
        return ResponseEntity.ok(DataListResponse.of(fleetDataQueryService.trips(limit, category)));
    }

    @GetMapping("/heatmap-data")
    public ResponseEntity<?> heatmapData(@RequestParam(required = false) String heatmapType) {
        return HeatmapType.fromParam(heatmapType)
                .<ResponseEntity<?>>map(type -> ResponseEntity.ok(DataListResponse.of(fleetDataQueryService.heatmap(type))))
                .orElseGet(() -> ResponseEntity.badRequest().body(ErrorBody.of("INVALID_HEATMAP_TYPE",
                        "Heatmap type must be one of density, speed, altitude")));
    }

    @GetMapping("/area-analysis")
    public ResponseEntity<Map<String, List<EnrichedGpsPoint>>> areaAnalysis() {
        return ResponseEntity.ok(fleetDataQueryService.areaAnalysis());
    }

    @GetMapping("/trip-analysis")
    public ResponseEntity<Map<String, List<EnrichedTripRecord>>> tripAnalysis() {
        return ResponseEntity.ok(fleetDataQueryService.tripAnalysis());
    }

    private static ResponseEntity<ErrorBody> invalidLimit() {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_LIMIT",
                "limit must be between 1 and " + QueryParamValidator.MAX_LIMIT));
    }
}
