package com.fleetinsight.api.dto;

/**
 * GET /api/v1 response.
 */
public record ServiceInfoResponse(String service, String version, String status) {
}
