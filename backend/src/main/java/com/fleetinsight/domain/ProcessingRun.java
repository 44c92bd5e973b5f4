package com.fleetinsight.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One enrichment run (load, enrich, save, aggregate). Updated as the run progresses; the latest run
 * backs the processing status endpoint.
 */
@Document(collection = "processing_runs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ProcessingRun {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private RunStatus status;
    private Stage stage;
    private int progressPct;
    private int currentBatch;
    private int totalBatches;
    private Integer gpsSaved;
    private Integer taxiSaved;
    private String errorMessage;
    private Instant startedAt;
    private Instant updatedAt;

    public enum RunStatus {
        RUNNING,
        COMPLETED,
        FAILED
    }

    public enum Stage {
        LOADING_DATA,
        ENRICHING_GPS,
        ENRICHING_TRIPS,
        SAVING_TO_DATABASE,
        CALCULATING_METRICS,
        COMPLETED,
        ERROR
    }
}
