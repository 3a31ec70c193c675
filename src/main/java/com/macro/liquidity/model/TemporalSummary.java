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
@Schema(description = "Month-to-date, quarter-to-date and rolling 3-month view of one column; absent parts are null")
public class TemporalSummary {

    private String column;

    private PeriodChange monthToDate;

    private PeriodChange quarterToDate;

    private RollingWindowSummary rolling3m;
}
