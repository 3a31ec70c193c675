package com.macro.liquidity.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything produced by one engine run: the full derived table for export, the
 * run summary, and the composite index time series.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRun {
    private AlignedTable table;
    private LiquiditySummary summary;
    private List<CompositeIndexRecord> compositeIndex;
}
