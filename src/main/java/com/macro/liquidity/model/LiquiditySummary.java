package com.macro.liquidity.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary of one analysis run; parts that could not be computed are null or absent from maps")
public class LiquiditySummary {

    @Schema(description = "Last date of the aligned table", nullable = true)
    private LocalDate asOf;

    @Schema(description = "Rows in the aligned table", example = "250")
    private int rows;

    private NetLiquidityBasis netLiquidityBasis;

    @Schema(description = "Temporal summaries keyed by column")
    private Map<String, TemporalSummary> temporal;

    @Schema(nullable = true)
    private SpikeAnalysis spreadSpikes;

    private StressIndexResult stress;

    private RegimeAssessment regime;

    @Schema(description = "Pearson correlations over the trailing window, keyed by pair name")
    private Map<String, Double> correlations;

    @Schema(description = "Trend forecasts keyed by column")
    private Map<String, TrendForecast> forecasts;

    @Schema(nullable = true)
    private FourWeekImpulseCheck fourWeekImpulse;

    private List<SeriesFreshness> freshness;

    private List<LiquidityAlert> alerts;

    @Schema(description = "Derivations skipped because a required input was missing")
    private List<String> skippedDerivations;

    @Schema(description = "Required series that were absent and became all-missing placeholder columns")
    private List<String> placeholderSeries;
}
