package com.macro.liquidity.config;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ForecastSettings {

    @Builder.Default
    int window = 20;

    @Builder.Default
    int minPoints = 10;

    @Builder.Default
    int horizon = 5;

    /** Relative slope tolerance under which a trend is labelled flat. */
    @Builder.Default
    double flatTolerance = 1e-9;

    @Builder.Default
    List<String> columns = List.of("Net_Liquidity", "RRP_Balance", "Spread_SOFR_IORB");

    public static ForecastSettings defaults() {
        return builder().build();
    }
}
