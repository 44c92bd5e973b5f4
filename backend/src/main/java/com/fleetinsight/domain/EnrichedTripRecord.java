package com.fleetinsight.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Taxi trip with its classification labels. Built once by the enrichment engine and never mutated;
 * only the id is assigned on save.
 */
@Document(collection = "processed_taxi_data")
@Value
@Builder
@AllArgsConstructor
public class EnrichedTripRecord {

    @Id
    @With
    String id;
    long durationSec;
    double durationMin;
    double distanceKm;
    double speedKph;
    double waitCost;
    double distanceCost;
    double fare;
    int passengerCount;
    boolean surgeApplied;

    @Indexed
    TripLengthLabel tripLengthLabel;
    PriceLabel priceLabel;
    /** In [0, 1]; null when the oracle gave no usable score. */
    Double efficiencyScore;
    /** Never populated: no component derives a time of day from the trip data. */
    String timeOfDay;
    String insights;
    Double confidence;
    ClassificationSource classificationSource;
    Instant processedAt;
}
