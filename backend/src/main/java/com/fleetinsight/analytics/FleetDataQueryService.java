package com.fleetinsight.analytics;

import com.fleetinsight.domain.AreaLabel;
import com.fleetinsight.domain.EnrichedGpsPoint;
import com.fleetinsight.domain.EnrichedGpsPointRepository;
import com.fleetinsight.domain.EnrichedTripRecord;
import com.fleetinsight.domain.EnrichedTripRecordRepository;
import com.fleetinsight.domain.TripLengthLabel;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Read side over the enriched corpus: label-filtered pages, heatmap triples and per-label breakdowns.
 */
@Service
@RequiredArgsConstructor
public class FleetDataQueryService {

    static final int AREA_ANALYSIS_LIMIT = 500;
    static final int TRIP_ANALYSIS_LIMIT = 200;

    private final EnrichedGpsPointRepository gpsRepository;
    private final EnrichedTripRecordRepository tripRepository;

    /** Up to {@code limit} points, optionally only those in {@code area}. */
    public List<EnrichedGpsPoint> gpsPoints(int limit, AreaLabel area) {
        PageRequest page = PageRequest.of(0, limit);
        return area != null ? gpsRepository.findByAreaLabel(area, page) : gpsRepository.findAllBy(page);
    }

    public List<EnrichedTripRecord> trips(int limit, TripLengthLabel tripLength) {
        PageRequest page = PageRequest.of(0, limit);
        return tripLength != null ? tripRepository.findByTripLengthLabel(tripLength, page) : tripRepository.findAllBy(page);
    }

    /** [lat, lng, weight] triples; weight is speed, or altitude for {@link HeatmapType#ALTITUDE}. */
    public List<double[]> heatmap(HeatmapType type) {
        return switch (type) {
            case DENSITY -> triples(gpsRepository.streamAllBy(), false);
            case SPEED -> triples(gpsRepository.streamBySpeedGreaterThan(0), false);
            case ALTITUDE -> triples(gpsRepository.streamByAltitudeGreaterThan(0), true);
        };
    }

    public Map<String, List<EnrichedGpsPoint>> areaAnalysis() {
        Map<String, List<EnrichedGpsPoint>> byArea = new LinkedHashMap<>();
        for (AreaLabel area : AreaLabel.values()) {
            byArea.put(area.label(), gpsPoints(AREA_ANALYSIS_LIMIT, area));
        }
        return byArea;
    }

    public Map<String, List<EnrichedTripRecord>> tripAnalysis() {
        Map<String, List<EnrichedTripRecord>> byCategory = new LinkedHashMap<>();
        for (TripLengthLabel category : TripLengthLabel.values()) {
            byCategory.put(category.label(), trips(TRIP_ANALYSIS_LIMIT, category));
        }
        return byCategory;
    }

    private static List<double[]> triples(Stream<EnrichedGpsPoint> points, boolean altitudeWeight) {
        try (points) {
            return points
                    .map(p -> new double[]{p.getLatitude(), p.getLongitude(), altitudeWeight ? p.getAltitude() : p.getSpeed()})
                    .toList();
        }
    }
}
