package com.macro.liquidity.config;

import com.macro.liquidity.model.SeriesFrequency;
import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.Map;

/**
 * Thresholds for the checks that run after the core analysis: correlations,
 * four-week impulse reconciliation, data freshness and alerts.
 */
@Value
@Builder
public class MonitoringSettings {

    @Builder.Default
    int correlationWindow = 63;

    @Builder.Default
    int correlationMinRows = 30;

    @Builder.Default
    double impulseToleranceAbs = 10_000.0;

    @Builder.Default
    double impulseTolerancePct = 1.0;

    @Builder.Default
    Map<SeriesFrequency, FreshnessRule> freshness = defaultFreshness();

    /** Extra days beyond the expected lag before a series counts as delayed. */
    @Builder.Default
    int delayGraceDays = 2;

    @Builder.Default
    double stressCriticalAt = 75.0;

    @Builder.Default
    double stressWarningAt = 50.0;

    /** Annualized quarter-to-date asset change (millions) below which QT pace is flagged. */
    @Builder.Default
    double qtPaceAnnualizedFloor = -1_000_000.0;

    @Builder.Default
    double netLiquidityLowPercentile = 10.0;

    @Builder.Default
    double netLiquidityHighPercentile = 90.0;

    /** Central-bank swap line usage (millions) that signals offshore dollar stress. */
    @Builder.Default
    double swapLinesThreshold = 1_000.0;

    public FreshnessRule freshnessFor(SeriesFrequency frequency) {
        return freshness.getOrDefault(frequency, freshness.get(SeriesFrequency.UNKNOWN));
    }

    public static MonitoringSettings defaults() {
        return builder().build();
    }

    public static Map<SeriesFrequency, FreshnessRule> defaultFreshness() {
        Map<SeriesFrequency, FreshnessRule> rules = new EnumMap<>(SeriesFrequency.class);
        rules.put(SeriesFrequency.DAILY, new FreshnessRule(2, 5));
        rules.put(SeriesFrequency.WEEKLY, new FreshnessRule(6, 14));
        rules.put(SeriesFrequency.POLICY_DRIVEN, new FreshnessRule(0, null));
        rules.put(SeriesFrequency.UNKNOWN, new FreshnessRule(7, 14));
        return rules;
    }

    /** Expected publication lag and the age after which a series is stale; null means never stale. */
    @Value
    public static class FreshnessRule {
        int expectedLagDays;
        Integer staleAfterDays;
    }
}
