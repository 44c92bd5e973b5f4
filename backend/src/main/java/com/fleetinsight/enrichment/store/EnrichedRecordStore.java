package com.fleetinsight.enrichment.store;

import com.fleetinsight.domain.EnrichedGpsPoint;
import com.fleetinsight.domain.EnrichedGpsPointRepository;
import com.fleetinsight.domain.EnrichedTripRecord;
import com.fleetinsight.domain.EnrichedTripRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Writes enriched records one by one. A record that fails to save is logged and skipped; the rest of the
 * list is still written. Returns the number of records saved.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnrichedRecordStore {

    private final EnrichedGpsPointRepository gpsRepository;
    private final EnrichedTripRecordRepository tripRepository;

    public int saveGps(List<EnrichedGpsPoint> points) {
        int saved = 0;
        for (EnrichedGpsPoint point : points) {
            try {
                gpsRepository.save(point);
                saved++;
            } catch (RuntimeException e) {
                log.error("Error saving GPS point {}: {}", point.getOriginalId(), e.getMessage(), e);
            }
        }
        log.info("Saved {}/{} GPS point(s)", saved, points.size());
        return saved;
    }

    public int saveTrips(List<EnrichedTripRecord> trips) {
        int saved = 0;
        for (EnrichedTripRecord trip : trips) {
            try {
                tripRepository.save(trip);
                saved++;
            } catch (RuntimeException e) {
                log.error("Error saving taxi trip ({} min, {} km): {}",
                        trip.getDurationMin(), trip.getDistanceKm(), e.getMessage(), e);
            }
        }
        log.info("Saved {}/{} taxi trip(s)", saved, trips.size());
        return saved;
    }
}
