package com.macro.liquidity.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One dated row of the composite liquidity index")
public class CompositeIndexRecord {

    private LocalDate date;

    @Schema(description = "Sub-index values keyed by sub-index name; a missing sub-index is absent from the map",
            example = "{\"fiscal\": 0.42, \"monetary\": -0.31}")
    private Map<String, Double> subIndices;

    @Schema(description = "Weighted sum of sub-indices", example = "0.06")
    private double composite;

    @Schema(description = "Fast moving average; null until the window is full", nullable = true)
    private Double compositeFast;

    @Schema(description = "Slow moving average; null until the window is full", nullable = true)
    private Double compositeSlow;

    private LiquidityRegimeBand band;
}
