package com.fleetinsight.api.controller;

import com.fleetinsight.api.dto.ErrorBody;
import com.fleetinsight.enrichment.job.ProcessingRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps rejected processing runs and malformed query parameters to 400 with ErrorBody.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ProcessingRejectedException.class)
    public ResponseEntity<ErrorBody> handleRejected(ProcessingRejectedException ex) {
        log.warn("Processing run rejected: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    /** Non-numeric limit and similar type mismatches. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PARAMETER", ex.getReason()));
    }
}
