package com.fleetinsight.api.dto;

import com.fleetinsight.domain.ProcessingRun;

import java.time.Instant;
import java.util.Locale;

/**
 * GET /api/v1/processing-status response. {@code status} is idle, running, completed or failed;
 * {@code stage} is the lower-case run stage (loading_data, saving_to_database, ...).
 */
public record ProcessingStatusResponse(
        String status,
        String stage,
        boolean processing,
        int progressPct,
        int currentBatch,
        int totalBatches,
        Integer gpsSaved,
        Integer taxiSaved,
        String errorMessage,
        Instant startedAt,
        Instant updatedAt
) {

    public static final String IDLE = "idle";

    public static ProcessingStatusResponse idle() {
        return new ProcessingStatusResponse(IDLE, null, false, 0, 0, 0, null, null, null, null, null);
    }

    public static ProcessingStatusResponse from(ProcessingRun run) {
        return new ProcessingStatusResponse(
                lower(run.getStatus()),
                lower(run.getStage()),
                run.getStatus() == ProcessingRun.RunStatus.RUNNING,
                run.getProgressPct(),
                run.getCurrentBatch(),
                run.getTotalBatches(),
                run.getGpsSaved(),
                run.getTaxiSaved(),
                run.getErrorMessage(),
                run.getStartedAt(),
                run.getUpdatedAt());
    }

    private static String lower(Enum<?> value) {
        return value != null ? value.name().toLowerCase(Locale.ROOT) : null;
    }
}
