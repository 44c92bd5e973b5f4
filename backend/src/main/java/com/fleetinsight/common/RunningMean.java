package com.fleetinsight.common;

/**
 * Single-pass mean accumulator for corpus scans. The mean of an empty set is 0.
 */
public final class RunningMean {

    private long count;
    private double sum;

    public void add(double value) {
        count++;
        sum += value;
    }

    public long count() {
        return count;
    }

    public double mean() {
        return count == 0 ? 0.0 : sum / count;
    }
}
