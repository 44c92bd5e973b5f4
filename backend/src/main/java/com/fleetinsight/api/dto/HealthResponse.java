package com.fleetinsight.api.dto;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp, boolean oracleConfigured) {
}
