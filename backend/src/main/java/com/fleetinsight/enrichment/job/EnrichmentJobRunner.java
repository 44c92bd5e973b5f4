package com.fleetinsight.enrichment.job;

import com.fleetinsight.analytics.AggregateMetrics;
import com.fleetinsight.analytics.AggregateMetricsCalculator;
import com.fleetinsight.analytics.MetricsStore;
import com.fleetinsight.config.AsyncConfig;
import com.fleetinsight.domain.EnrichedGpsPoint;
import com.fleetinsight.domain.EnrichedTripRecord;
import com.fleetinsight.domain.ProcessingRun;
import com.fleetinsight.domain.ProcessingRun.Stage;
import com.fleetinsight.domain.RawGpsPoint;
import com.fleetinsight.domain.RawTripRecord;
import com.fleetinsight.enrichment.batch.BatchDriver;
import com.fleetinsight.enrichment.batch.BatchProgress;
import com.fleetinsight.enrichment.config.EnrichmentProperties;
import com.fleetinsight.enrichment.loader.GpsCsvLoader;
import com.fleetinsight.enrichment.loader.TripCsvLoader;
import com.fleetinsight.enrichment.oracle.InsightOracle;
import com.fleetinsight.enrichment.pipeline.EnrichmentEngine;
import com.fleetinsight.enrichment.progress.ProcessingRunTracker;
import com.fleetinsight.enrichment.store.EnrichedRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts enrichment runs and executes them on the enrichment executor: load both CSV exports, enrich GPS
 * then trips batch by batch, save, then recompute and store aggregate metrics. At most one run is active.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EnrichmentJobRunner {

    static final int GPS_PROGRESS_END = 25;
    static final int TRIPS_PROGRESS_END = 50;
    static final int SAVE_PROGRESS = 50;
    static final int METRICS_PROGRESS = 90;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final EnrichmentProperties enrichmentProperties;
    private final InsightOracle insightOracle;
    private final GpsCsvLoader gpsCsvLoader;
    private final TripCsvLoader tripCsvLoader;
    private final BatchDriver batchDriver;
    private final EnrichmentEngine enrichmentEngine;
    private final EnrichedRecordStore enrichedRecordStore;
    private final AggregateMetricsCalculator aggregateMetricsCalculator;
    private final MetricsStore metricsStore;
    private final ProcessingRunTracker processingRunTracker;
    @Qualifier(AsyncConfig.ENRICHMENT_EXECUTOR)
    private final Executor enrichmentExecutor;

    /**
     * Registers a new run and hands it to the enrichment executor.
     *
     * @return the RUNNING run document
     * @throws ProcessingRejectedException when a run is active or the oracle has no API key
     */
    public ProcessingRun start() {
        if (!running.compareAndSet(false, true)) {
            throw new ProcessingRejectedException(ProcessingRejectedException.ALREADY_PROCESSING,
                    "Data processing already in progress");
        }
        ProcessingRun run = null;
        try {
            if (!insightOracle.isConfigured()) {
                throw new ProcessingRejectedException(ProcessingRejectedException.ORACLE_NOT_CONFIGURED,
                        "Oracle API key not configured. Set OPENAI_API_KEY.");
            }
            run = processingRunTracker.start();
            String runId = run.getId();
            enrichmentExecutor.execute(() -> runAndRelease(runId));
        } catch (RuntimeException e) {
            if (run != null) {
                log.error("Processing run {} could not be scheduled: {}", run.getId(), e.getMessage());
                processingRunTracker.setFailed(run.getId(), "Could not schedule processing: " + e.getMessage());
            }
            running.set(false);
            throw e;
        }
        log.info("Processing run {} started", run.getId());
        return run;
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runAndRelease(String runId) {
        try {
            run(runId);
        } finally {
            running.set(false);
        }
    }

    void run(String runId) {
        try {
            List<RawGpsPoint> gps = gpsCsvLoader.load(Path.of(enrichmentProperties.getGpsCsvPath()));
            List<RawTripRecord> trips = tripCsvLoader.load(Path.of(enrichmentProperties.getTaxiCsvPath()));
            log.info("Run {}: loaded {} GPS points and {} taxi trips", runId, gps.size(), trips.size());

            int batchSize = enrichmentProperties.getBatchSize();
            List<EnrichedGpsPoint> enrichedGps = batchDriver.run("GPS", gps, batchSize,
                    enrichmentEngine::enrichGps,
                    new BatchProgress((batch, total, done) -> processingRunTracker.onBatch(
                            runId, Stage.ENRICHING_GPS, batch, total, 0, GPS_PROGRESS_END)));
            List<EnrichedTripRecord> enrichedTrips = batchDriver.run("taxi", trips, batchSize,
                    enrichmentEngine::enrichTrips,
                    new BatchProgress((batch, total, done) -> processingRunTracker.onBatch(
                            runId, Stage.ENRICHING_TRIPS, batch, total, GPS_PROGRESS_END, TRIPS_PROGRESS_END)));

            processingRunTracker.setStage(runId, Stage.SAVING_TO_DATABASE, SAVE_PROGRESS);
            int gpsSaved = enrichedRecordStore.saveGps(enrichedGps);
            int taxiSaved = enrichedRecordStore.saveTrips(enrichedTrips);

            processingRunTracker.setStage(runId, Stage.CALCULATING_METRICS, METRICS_PROGRESS);
            AggregateMetrics metrics = aggregateMetricsCalculator.computeAggregates();
            metricsStore.saveMetrics(metrics);

            processingRunTracker.setComplete(runId, gpsSaved, taxiSaved);
            log.info("Run {} completed: {} GPS points and {} taxi trips saved", runId, gpsSaved, taxiSaved);
        } catch (Exception e) {
            log.error("Run {} failed", runId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            processingRunTracker.setFailed(runId, message);
        }
    }
}
