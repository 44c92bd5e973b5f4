package com.fleetinsight.api.dto;

/**
 * POST /api/v1/process-data response (202).
 */
public record ProcessDataResponse(String message, String status, String runId) {
}
