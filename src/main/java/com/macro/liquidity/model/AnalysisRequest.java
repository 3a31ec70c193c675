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
@Schema(description = "Batch snapshot of raw series to analyse")
public class AnalysisRequest {

    @Schema(description = "Rows before this date are dropped after gap filling", example = "2024-01-01")
    private LocalDate startDate;

    @Schema(description = "Report date used for freshness checks; defaults to the table's last date", nullable = true)
    private LocalDate reportDate;

    @Schema(description = "Primary series")
    private List<SeriesPayload> series;

    @Schema(description = "Faster secondary sources; only fill dates the primary series with the same name is missing",
            nullable = true)
    private List<SeriesPayload> supplements;

    @Schema(description = "List-of-records source pivoted into one series per key; on a duplicate "
            + "(date, key) pair the first record wins", nullable = true)
    private List<LongRecord> records;

    @Schema(description = "Frequency of the series pivoted from records: daily, weekly, policy or unknown",
            example = "daily", nullable = true)
    private String recordFrequency;

    @Schema(description = "Include every table column in the response", example = "false")
    private boolean includeTable;
}
