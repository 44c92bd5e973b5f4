package com.fleetinsight.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.stream.Stream;

/**
 * Persistence for processed_taxi_data.
 */
public interface EnrichedTripRecordRepository extends MongoRepository<EnrichedTripRecord, String> {

    List<EnrichedTripRecord> findByTripLengthLabel(TripLengthLabel tripLengthLabel, Pageable pageable);

    List<EnrichedTripRecord> findAllBy(Pageable pageable);

    Stream<EnrichedTripRecord> streamAllBy();
}
