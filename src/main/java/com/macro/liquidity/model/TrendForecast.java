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
@Schema(description = "Short-horizon linear trend fitted to the recent valid points of one column")
public class TrendForecast {

    @Schema(example = "Net_Liquidity")
    private String column;

    @Schema(description = "Change per session")
    private double slope;

    private double intercept;

    @Schema(description = "Latest valid value used in the fit")
    private double current;

    @Schema(description = "Fitted values for the next sessions, nearest first")
    private List<Double> forecast;

    @Schema(description = "Forecast at the end of the horizon")
    private double forecastAtHorizon;

    private TrendDirection direction;

    @Schema(description = "Coefficient of determination; 0 when the fitted points have no variance", example = "0.82")
    private double rSquared;

    @Schema(description = "Valid points used in the fit", example = "20")
    private int points;
}
