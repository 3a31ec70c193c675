package com.macro.liquidity.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Reconciliation of the two four-week fiscal impulse definitions")
public class FourWeekImpulseCheck {

    @Schema(example = "Net_Impulse")
    private String column;

    private LocalDate asOf;

    @Schema(description = "Sum over the trailing 20 sessions")
    private double slidingSum;

    @Schema(description = "Sum over the four most recent Monday-to-Friday weeks")
    private double blockSum;

    @Schema(description = "blockSum - slidingSum")
    private double difference;

    @Schema(description = "|difference| as a percentage of |slidingSum|; null when slidingSum is 0", nullable = true)
    private Double differencePct;

    @Schema(description = "True when both the absolute and the percentage tolerance hold")
    private boolean withinTolerance;
}
