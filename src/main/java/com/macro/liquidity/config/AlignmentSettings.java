package com.macro.liquidity.config;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AlignmentSettings {

    /** Calendar days a daily series may be carried forward past its last real observation. */
    @Builder.Default
    int dailyFillLimitDays = 3;

    /** Series that must exist as columns even when no source delivered them. */
    @Builder.Default
    List<String> requiredSeries = List.of();

    public static AlignmentSettings defaults() {
        return builder().build();
    }
}
