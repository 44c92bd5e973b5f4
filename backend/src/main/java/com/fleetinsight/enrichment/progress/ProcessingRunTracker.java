package com.fleetinsight.enrichment.progress;

import com.fleetinsight.domain.ProcessingRun;
import com.fleetinsight.domain.ProcessingRun.RunStatus;
import com.fleetinsight.domain.ProcessingRun.Stage;
import com.fleetinsight.domain.ProcessingRunRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Updates processing_runs while an enrichment run moves through its stages.
 */
@Component
@RequiredArgsConstructor
public class ProcessingRunTracker {

    private final ProcessingRunRepository processingRunRepository;
    private final Clock clock;

    /**
     * Creates a RUNNING run at LOADING_DATA, 0%.
     */
    public ProcessingRun start() {
        Instant now = Instant.now(clock);
        ProcessingRun run = new ProcessingRun();
        run.setStatus(RunStatus.RUNNING);
        run.setStage(Stage.LOADING_DATA);
        run.setProgressPct(0);
        run.setStartedAt(now);
        run.setUpdatedAt(now);
        return processingRunRepository.save(run);
    }

    public void setStage(String runId, Stage stage, int progressPct) {
        update(runId, r -> {
            r.setStage(stage);
            r.setProgressPct(progressPct);
        });
    }

    /**
     * Maps batch completion onto the [fromPct, toPct] slice of overall progress.
     */
    public void onBatch(String runId, Stage stage, int batchNumber, int totalBatches, int fromPct, int toPct) {
        int pct = totalBatches <= 0
                ? toPct
                : fromPct + (toPct - fromPct) * batchNumber / totalBatches;
        update(runId, r -> {
            r.setStage(stage);
            r.setCurrentBatch(batchNumber);
            r.setTotalBatches(totalBatches);
            r.setProgressPct(pct);
        });
    }

    public void setComplete(String runId, int gpsSaved, int taxiSaved) {
        update(runId, r -> {
            r.setStatus(RunStatus.COMPLETED);
            r.setStage(Stage.COMPLETED);
            r.setProgressPct(100);
            r.setGpsSaved(gpsSaved);
            r.setTaxiSaved(taxiSaved);
            r.setErrorMessage(null);
        });
    }

    public void setFailed(String runId, String errorMessage) {
        update(runId, r -> {
            r.setStatus(RunStatus.FAILED);
            r.setStage(Stage.ERROR);
            r.setProgressPct(0);
            r.setErrorMessage(errorMessage);
        });
    }

    public Optional<ProcessingRun> latest() {
        return processingRunRepository.findFirstByOrderByStartedAtDesc();
    }

    private void update(String runId, Consumer<ProcessingRun> change) {
        processingRunRepository.findById(runId)
                .ifPresent(r -> {
                    change.accept(r);
                    r.setUpdatedAt(Instant.now(clock));
                    processingRunRepository.save(r);
                });
    }
}
