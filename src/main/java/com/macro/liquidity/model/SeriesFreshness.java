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
@Schema(description = "Publication freshness of one input series")
public class SeriesFreshness {

    @Schema(example = "SOFR")
    private String series;

    private SeriesFrequency frequency;

    @Schema(description = "Last-updated date, or the latest observation date when none was supplied", nullable = true)
    private LocalDate lastUpdated;

    @Schema(description = "Calendar days between lastUpdated and the report date", nullable = true)
    private Long daysOld;

    @Schema(description = "Publication lag normally expected for this frequency", example = "2")
    private int expectedLagDays;

    private FreshnessStatus status;
}
