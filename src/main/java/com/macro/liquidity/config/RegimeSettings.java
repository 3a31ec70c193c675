package com.macro.liquidity.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RegimeSettings {

    @Builder.Default
    int lookback = 20;

    /** Change in total assets (millions) over the lookback that counts as QT or QE. */
    @Builder.Default
    double assetTrendThreshold = 10_000.0;

    /** Change in reverse-repo balance (billions) over the lookback that counts as a drain or a release. */
    @Builder.Default
    double reserveDrainThreshold = 50.0;

    /** Latest weekly asset change (millions) that counts as strong QT or QE. */
    @Builder.Default
    double paceThreshold = 5_000.0;

    public static RegimeSettings defaults() {
        return builder().build();
    }
}
