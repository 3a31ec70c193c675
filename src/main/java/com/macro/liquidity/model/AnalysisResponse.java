package com.macro.liquidity.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of one analysis run")
public class AnalysisResponse {

    private LiquiditySummary summary;

    private List<CompositeIndexRecord> compositeIndex;

    @Schema(description = "Full derived table; only present when requested", nullable = true)
    private TableSnapshot table;
}
