package com.macro.liquidity.config;

import com.macro.liquidity.model.MetricNames;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DerivationSettings {

    /** Reverse-repo balance is published in billions; everything else is in millions. */
    @Builder.Default
    double rrpToMillions = 1000.0;

    @Builder.Default
    int weeklyLag = 5;

    @Builder.Default
    int monthlyLag = 22;

    @Builder.Default
    int quarterlyLag = 65;

    @Builder.Default
    int yearOverYearLag = 252;

    @Builder.Default
    int fastWindow = 5;

    @Builder.Default
    int slowWindow = 20;

    @Builder.Default
    int volatilityWindow = 5;

    @Builder.Default
    int volatilityMinPeriods = 2;

    /** SOFR above IORB by more than this (percent) raises {@code Stress_Flag}. */
    @Builder.Default
    double stressFlagMargin = 0.05;

    @Builder.Default
    int fourWeekSessions = 20;

    @Builder.Default
    List<SpreadDefinition> spreads = defaultSpreads();

    /** Minimum valid observations for a rolling average: roughly half the window. */
    public int minPeriodsFor(int window) {
        return Math.max(1, window / 2);
    }

    public static DerivationSettings defaults() {
        return builder().build();
    }

    public static List<SpreadDefinition> defaultSpreads() {
        return List.of(
                SpreadDefinition.builder().name(MetricNames.SPREAD_SOFR_IORB)
                        .minuend(MetricNames.SOFR).subtrahend(MetricNames.IORB).build(),
                SpreadDefinition.builder().name(MetricNames.SPREAD_EFFR_IORB)
                        .minuend(MetricNames.EFFR).subtrahend(MetricNames.IORB).build(),
                SpreadDefinition.builder().name(MetricNames.SPREAD_TGCR_SOFR)
                        .minuend(MetricNames.TGCR).subtrahend(MetricNames.SOFR).build(),
                SpreadDefinition.builder().name(MetricNames.CURVE_2S10S)
                        .minuend(MetricNames.TREASURY_10Y).subtrahend(MetricNames.TREASURY_2Y)
                        .multiplier(1.0).build(),
                SpreadDefinition.builder().name(MetricNames.CURVE_5S30S)
                        .minuend(MetricNames.TREASURY_30Y).subtrahend(MetricNames.TREASURY_5Y)
                        .multiplier(1.0).build());
    }
}
