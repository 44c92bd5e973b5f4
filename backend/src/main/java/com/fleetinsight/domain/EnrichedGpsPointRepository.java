package com.fleetinsight.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.stream.Stream;

/**
 * Persistence for processed_gps_data. Streams are used for full-corpus scans (aggregation, heatmaps).
 */
public interface EnrichedGpsPointRepository extends MongoRepository<EnrichedGpsPoint, String> {

    List<EnrichedGpsPoint> findByAreaLabel(AreaLabel areaLabel, Pageable pageable);

    List<EnrichedGpsPoint> findAllBy(Pageable pageable);

    Stream<EnrichedGpsPoint> streamAllBy();

    Stream<EnrichedGpsPoint> streamBySpeedGreaterThan(double speed);

    Stream<EnrichedGpsPoint> streamByAltitudeGreaterThan(double altitude);
}
