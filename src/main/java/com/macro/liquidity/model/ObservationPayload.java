package com.macro.liquidity.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One dated observation")
public class ObservationPayload {

    @Schema(example = "2025-05-15")
    private LocalDate date;

    @Schema(description = "Observation value; null marks a missing value", example = "5.31", nullable = true)
    private Double value;
}
