package com.macro.liquidity.config;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.macro.liquidity.model.MetricNames.FED_TOTAL_ASSETS;
import static com.macro.liquidity.model.MetricNames.NET_LIQUIDITY;
import static com.macro.liquidity.model.MetricNames.NET_LIQUIDITY_NO_TGA;
import static com.macro.liquidity.model.MetricNames.REPO_OPS_BALANCE;
import static com.macro.liquidity.model.MetricNames.RRP_BALANCE;
import static com.macro.liquidity.model.MetricNames.SPREAD_EFFR_IORB;
import static com.macro.liquidity.model.MetricNames.SPREAD_SOFR_IORB;
import static com.macro.liquidity.model.MetricNames.TGA_BALANCE;

@Value
@Builder
public class TemporalSettings {

    @Builder.Default
    int rollingWindow = 63;

    @Builder.Default
    int sessionsPerYear = 252;

    /** Percentage changes beyond this magnitude are reported as 0. */
    @Builder.Default
    double maxAbsPercentChange = 500.0;

    /** First month of quarter one; 1 for calendar quarters, 10 for an October fiscal year. */
    @Builder.Default
    int quarterStartMonth = 1;

    /**
     * Slope per session beyond which the rolling trend is labelled rising or declining,
     * for columns without an entry in {@link #trendSlopeThresholds}.
     */
    @Builder.Default
    double trendSlopeThreshold = 1000.0;

    /** Per-column slope thresholds, in each column's own unit per session. */
    @Builder.Default
    Map<String, Double> trendSlopeThresholds = defaultTrendSlopeThresholds();

    /** Valid observations needed inside the rolling window; half the window, as for moving averages. */
    public int rollingMinValid() {
        return Math.max(2, rollingWindow / 2);
    }

    public double trendSlopeThresholdFor(String column) {
        return trendSlopeThresholds.getOrDefault(column, trendSlopeThreshold);
    }

    public static TemporalSettings defaults() {
        return builder().build();
    }

    public static Map<String, Double> defaultTrendSlopeThresholds() {
        Map<String, Double> thresholds = new LinkedHashMap<>();
        // millions
        thresholds.put(NET_LIQUIDITY, 1000.0);
        thresholds.put(NET_LIQUIDITY_NO_TGA, 1000.0);
        thresholds.put(FED_TOTAL_ASSETS, 1000.0);
        thresholds.put(TGA_BALANCE, 1000.0);
        thresholds.put(REPO_OPS_BALANCE, 1000.0);
        // billions
        thresholds.put(RRP_BALANCE, 1.0);
        // basis points
        thresholds.put(SPREAD_SOFR_IORB, 0.1);
        thresholds.put(SPREAD_EFFR_IORB, 0.1);
        return thresholds;
    }
}
