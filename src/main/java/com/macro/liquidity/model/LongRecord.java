package com.macro.liquidity.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One observation from a list-of-records source, e.g. a daily fiscal transaction
 * total for one spending category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One (date, key, value) record")
public class LongRecord {

    @Schema(example = "2025-05-15")
    private LocalDate date;

    @Schema(description = "Series the record belongs to", example = "Medicare")
    private String key;

    @Schema(example = "3120.0", nullable = true)
    private Double value;
}
