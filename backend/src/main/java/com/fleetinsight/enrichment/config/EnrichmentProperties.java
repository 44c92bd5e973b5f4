package com.fleetinsight.enrichment.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Enrichment run config: input files and batch size.
 */
@ConfigurationProperties(prefix = "fleetinsight.enrichment")
@NoArgsConstructor
@Getter
@Setter
public class EnrichmentProperties {

    /** Records per batch; progress is reported after each batch. */
    private int batchSize = 1000;

    /** GPS export (randomized_id, lat, lng, alt, spd, azm). */
    private String gpsCsvPath = "data/geo_locations_astana_hackathon.csv";

    /** Taxi trip export. */
    private String taxiCsvPath = "data/Taxi_Set.csv";
}
