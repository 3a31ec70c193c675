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
@Schema(description = "Change of one column within a month-to-date or quarter-to-date window")
public class PeriodChange {

    @Schema(description = "Column the change was computed for", example = "Net_Liquidity")
    private String column;

    private PeriodWindow window;

    @Schema(description = "First valid value inside the window")
    private double firstValue;

    @Schema(description = "Last valid value inside the window")
    private double lastValue;

    @Schema(description = "Last valid minus first valid value")
    private double change;

    @Schema(description = "Change as a percentage of the period-start value; 0 when the baseline is non-positive or the result is implausible")
    private double changePct;

    @Schema(description = "Mean of the valid values inside the window")
    private double average;

    private double min;

    private double max;

    @Schema(description = "Number of table rows (sessions) inside the window", example = "32")
    private int sessions;

    @Schema(description = "Change scaled to a 252-session year; only set for quarter-to-date windows", nullable = true)
    private Double annualizedPace;
}
