package com.fleetinsight.api.controller;

import com.fleetinsight.api.dto.HealthResponse;
import com.fleetinsight.api.dto.ServiceInfoResponse;
import com.fleetinsight.enrichment.oracle.InsightOracle;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * GET / and GET /health.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthController {

    static final String SERVICE_NAME = "Fleet Insight API";
    static final String VERSION = "1.0.0";

    private final InsightOracle insightOracle;
    private final Clock clock;

    @GetMapping({"", "/"})
    public ResponseEntity<ServiceInfoResponse> root() {
        return ResponseEntity.ok(new ServiceInfoResponse(SERVICE_NAME, VERSION, "running"));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", Instant.now(clock), insightOracle.isConfigured()));
    }
}
