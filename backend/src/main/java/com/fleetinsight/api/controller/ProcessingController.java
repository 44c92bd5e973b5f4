package com.fleetinsight.api.controller;

import com.fleetinsight.api.dto.ProcessDataResponse;
import com.fleetinsight.api.dto.ProcessingStatusResponse;
import com.fleetinsight.domain.ProcessingRun;
import com.fleetinsight.enrichment.job.EnrichmentJobRunner;
import com.fleetinsight.enrichment.progress.ProcessingRunTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /process-data starts an enrichment run; GET /processing-status reports the latest one.
 * Rejections are mapped to 400 by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ProcessingController {

    private final EnrichmentJobRunner enrichmentJobRunner;
    private final ProcessingRunTracker processingRunTracker;

    @PostMapping("/process-data")
    public ResponseEntity<ProcessDataResponse> processData() {
        ProcessingRun run = enrichmentJobRunner.start();
        return ResponseEntity.accepted().body(new ProcessDataResponse("Data processing started", "processing", run.getId()));
    }

    @GetMapping("/processing-status")
    public ResponseEntity<ProcessingStatusResponse> processingStatus() {
        return ResponseEntity.ok(processingRunTracker.latest()
                .map(ProcessingStatusResponse::from)
                .orElseGet(ProcessingStatusResponse::idle));
    }
}
