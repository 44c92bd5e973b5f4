package com.fleetinsight.enrichment.job;

import lombok.Getter;

/**
 * Thrown when a processing run cannot be started. The error code is returned to API clients.
 */
@Getter
public class ProcessingRejectedException extends RuntimeException {

    public static final String ALREADY_PROCESSING = "ALREADY_PROCESSING";
    public static final String ORACLE_NOT_CONFIGURED = "ORACLE_NOT_CONFIGURED";

    private final String errorCode;

    public ProcessingRejectedException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
