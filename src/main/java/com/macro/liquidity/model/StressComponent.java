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
@Schema(description = "One validated stress sub-score")
public class StressComponent {

    @Schema(example = "sofr_spread")
    private String name;

    @Schema(description = "Sub-score clamped to [0, 100]", example = "60.0")
    private double value;

    @Schema(description = "Static weight in the stress index", example = "0.30")
    private double weight;

    @Schema(description = "False when the input was missing and the component defaulted to 0")
    private boolean available;

    public double weightedValue() {
        return value * weight;
    }
}
