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
@Schema(description = "Monetary regime voted from directional signals over a short lookback")
public class RegimeAssessment {

    @Schema(example = "QT")
    private MonetaryRegime regime;

    @Schema(description = "Winning pooled count over total signals, capped at 100", example = "66.67")
    private double confidence;

    @Schema(description = "Signals in detector order", example = "[\"QT\", \"EASING\", \"QT\"]")
    private List<RegimeSignal> signals;

    public static RegimeAssessment unknown() {
        return RegimeAssessment.builder()
                .regime(MonetaryRegime.UNKNOWN)
                .confidence(0.0)
                .signals(List.of())
                .build();
    }
}
