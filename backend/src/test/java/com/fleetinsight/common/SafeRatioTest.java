package com.fleetinsight.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SafeRatioTest {

    @Test
    @DisplayName("division by zero, negative or NaN denominator yields 0")
    void divideOrZero() {
        assertThat(SafeRatio.divideOrZero(10, 4)).isEqualTo(2.5);
        assertThat(SafeRatio.divideOrZero(10, 0)).isZero();
        assertThat(SafeRatio.divideOrZero(10, -1)).isZero();
        assertThat(SafeRatio.divideOrZero(10, Double.NaN)).isZero();
    }

    @Test
    @DisplayName("percentOrZero over an empty total is 0")
    void percentOrZero() {
        assertThat(SafeRatio.percentOrZero(1, 4)).isEqualTo(25.0);
        assertThat(SafeRatio.percentOrZero(0, 0)).isZero();
    }

    @Test
    @DisplayName("running mean of nothing is 0")
    void runningMean() {
        RunningMean mean = new RunningMean();
        assertThat(mean.mean()).isZero();
        mean.add(2);
        mean.add(4);
        assertThat(mean.count()).isEqualTo(2);
        assertThat(mean.mean()).isEqualTo(3.0);
    }
}
