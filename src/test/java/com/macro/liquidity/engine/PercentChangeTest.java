package com.macro.liquidity.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PercentChangeTest {

    @Test
    void ordinaryChange() {
        assertThat(PercentChange.of(110, 10, 500)).isCloseTo(10.0, within(1e-9));
        assertThat(PercentChange.of(90, -10, 500)).isCloseTo(-10.0, within(1e-9));
    }

    @Test
    void negativeBaseline_reportsZero() {
        // baseline 100 - 1200 = -1100
        assertThat(PercentChange.of(100, 1200, 500)).isEqualTo(0.0);
    }

    @Test
    void zeroBaseline_reportsZero() {
        assertThat(PercentChange.of(10, 10, 500)).isEqualTo(0.0);
    }

    @Test
    void implausibleMagnitude_reportsZero() {
        // baseline 100, change 600 -> 600%
        assertThat(PercentChange.of(700, 600, 500)).isEqualTo(0.0);
    }

    @Test
    void missingInputs_reportZero() {
        assertThat(PercentChange.of(Double.NaN, 10, 500)).isEqualTo(0.0);
        assertThat(PercentChange.of(100, Double.NaN, 500)).isEqualTo(0.0);
    }
}
