package com.fleetinsight.enrichment.loader;

/**
 * The input file could not be opened or read as CSV.
 */
public class RecordLoadException extends RuntimeException {

    public RecordLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
