package com.macro.liquidity.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SpikeSettings {

    @Builder.Default
    int window = 20;

    @Builder.Default
    int minPeriods = 10;

    /** k in mean + k * std. */
    @Builder.Default
    double thresholdStd = 2.0;

    /** Absolute level in bps above which any value is a spike. */
    @Builder.Default
    double absoluteThresholdBps = 10.0;

    @Builder.Default
    int percentileWindow = 63;

    @Builder.Default
    int percentileMinPeriods = 40;

    @Builder.Default
    double percentile = 0.95;

    /** Valid points required before any analysis is produced. */
    @Builder.Default
    int minObservations = 20;

    public static SpikeSettings defaults() {
        return builder().build();
    }
}
