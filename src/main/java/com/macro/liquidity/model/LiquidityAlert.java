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
@Schema(description = "Condition worth a reader's attention on the latest run")
public class LiquidityAlert {

    private AlertSeverity severity;

    @Schema(example = "STRESS")
    private String type;

    @Schema(example = "Stress index at 78/100 (HIGH_STRESS)")
    private String message;
}
