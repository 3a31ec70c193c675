package com.macro.liquidity.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Trailing-window statistics for one column (default 63 sessions)")
public class RollingWindowSummary {

    private String column;

    private PeriodWindow window;

    @Schema(description = "Value on the last table row")
    private double current;

    private double average;

    @Schema(description = "Sample standard deviation; absent with fewer than two valid points", nullable = true)
    private Double std;

    @Schema(description = "Share of window values strictly below the current value (0-100)", example = "87.3")
    private double percentileRank;

    @Schema(description = "Least-squares slope per session over the window")
    private double slope;

    private TrendDirection trend;
}
