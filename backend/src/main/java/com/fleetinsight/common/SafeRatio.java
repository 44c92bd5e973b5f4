package com.fleetinsight.common;

/**
 * Ratios that degrade to 0 instead of dividing by zero (aggregates over empty sets).
 */
public final class SafeRatio {

    private SafeRatio() {
    }

    /** numerator / denominator when denominator &gt; 0, else 0. */
    public static double divideOrZero(double numerator, double denominator) {
        if (!(denominator > 0)) {
            return 0.0;
        }
        return numerator / denominator;
    }

    /** part / total * 100 when total &gt; 0, else 0. */
    public static double percentOrZero(long part, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return (double) part / total * 100.0;
    }
}
