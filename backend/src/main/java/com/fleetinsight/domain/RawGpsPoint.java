package com.fleetinsight.domain;

/**
 * One row of the GPS input file. Speed is in m/s, azimuth in degrees.
 */
public record RawGpsPoint(String id, double latitude, double longitude, double altitude,
                          double speed, double azimuth) {
}
