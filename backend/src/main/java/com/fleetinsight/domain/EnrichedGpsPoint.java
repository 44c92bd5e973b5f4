package com.fleetinsight.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * GPS point with its classification labels. Built once by the enrichment engine and never mutated;
 * only the id is assigned on save.
 */
@Document(collection = "processed_gps_data")
@CompoundIndex(name = "lat_lng", def = "{'latitude': 1, 'longitude': 1}")
@Value
@Builder
@AllArgsConstructor
public class EnrichedGpsPoint {

    @Id
    @With
    String id;
    @Indexed
    String originalId;
    double latitude;
    double longitude;
    double altitude;
    double speed;
    double azimuth;

    /** Null when the oracle answered without a recognisable area. */
    @Indexed
    AreaLabel areaLabel;
    ActivityLabel activityLabel;
    /** Free-form road type from the oracle; "Unknown" on fallback. */
    String roadType;
    /** Oracle insight text, raw oracle answer, or the fallback error description. */
    String insights;
    Double confidence;
    ClassificationSource classificationSource;
    Instant processedAt;
}
