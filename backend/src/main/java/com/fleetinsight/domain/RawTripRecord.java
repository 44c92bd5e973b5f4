package com.fleetinsight.domain;

/**
 * One row of the taxi trip input file. Fare and costs are in USD.
 */
public record RawTripRecord(long durationSec, double durationMin, double distanceKm, double speedKph,
                            double waitCost, double distanceCost, double fare, int passengerCount,
                            boolean surgeApplied) {
}
