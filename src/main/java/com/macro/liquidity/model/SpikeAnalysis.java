package com.macro.liquidity.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Spike detection result for the latest value of a spread series")
public class SpikeAnalysis {

    @Schema(example = "Spread_SOFR_IORB")
    private String column;

    private LocalDate asOf;

    @Schema(description = "Latest valid value (bps)", example = "12.0")
    private double currentValue;

    @Schema(description = "Whether any rule flagged the latest value")
    private boolean spike;

    @Schema(description = "Names of the rules that flagged the latest value", example = "[\"ABSOLUTE\"]")
    private List<String> triggeredRules;

    @Schema(description = "Sigma-band classification of the latest value")
    private SpikeSeverity severity;

    @Schema(description = "Rolling mean over the threshold window", nullable = true)
    private Double movingAverage;

    @Schema(description = "Rolling mean + k * rolling std", nullable = true)
    private Double thresholdUpper;

    @Schema(description = "Flagged observations since the start of the month")
    private int mtdSpikeCount;

    @Schema(description = "Flagged observations since the start of the quarter")
    private int qtdSpikeCount;

    @Schema(description = "Maximum over the trailing 3-month window")
    private double max3m;

    private LocalDate max3mDate;
}
