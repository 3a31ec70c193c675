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
@Schema(description = "Composite money-market stress index")
public class StressIndexResult {

    private LocalDate asOf;

    @Schema(description = "Weighted stress score (0-100)", example = "31.5")
    private double score;

    private StressLevel level;

    private List<StressComponent> components;
}
