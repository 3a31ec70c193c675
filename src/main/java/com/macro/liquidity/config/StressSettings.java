package com.macro.liquidity.config;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class StressSettings {

    public static final String SOFR_SPREAD = "sofr_spread";
    public static final String EFFR_SPREAD = "effr_spread";
    public static final String VOLATILITY = "volatility";
    public static final String RRP_USAGE = "rrp_usage";
    public static final String REPO_USAGE = "repo_usage";

    @Builder.Default
    Map<String, Double> weights = defaultWeights();

    /** SOFR-IORB spread (bps) that maps to a full score. */
    @Builder.Default
    double sofrSpreadCapBps = 20.0;

    @Builder.Default
    double effrSpreadFloorBps = -5.0;

    @Builder.Default
    double effrSpreadCapBps = 15.0;

    /** 5-day SOFR standard deviation (percent) that maps to a full score. */
    @Builder.Default
    double volatilityCap = 0.10;

    /** Repo facility usage (millions) that maps to a full score. */
    @Builder.Default
    double repoUsageCap = 100_000.0;

    @Builder.Default
    double moderateAt = 25.0;

    @Builder.Default
    double elevatedAt = 50.0;

    @Builder.Default
    double highAt = 75.0;

    public double weightOf(String component) {
        return weights.getOrDefault(component, 0.0);
    }

    public static StressSettings defaults() {
        return builder().build();
    }

    public static Map<String, Double> defaultWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(SOFR_SPREAD, 0.30);
        weights.put(EFFR_SPREAD, 0.20);
        weights.put(VOLATILITY, 0.15);
        weights.put(RRP_USAGE, 0.20);
        weights.put(REPO_USAGE, 0.15);
        return weights;
    }
}
