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
@Schema(description = "Analysis window anchored to the table's last date")
public class PeriodWindow {

    @Schema(description = "First calendar day of the window", example = "2025-04-01")
    private LocalDate start;

    @Schema(description = "Last date of the table", example = "2025-05-16")
    private LocalDate end;

    @Schema(description = "Window kind", example = "QUARTER_TO_DATE")
    private PeriodKind kind;

    public static PeriodWindow monthToDate(LocalDate lastDate) {
        return new PeriodWindow(lastDate.withDayOfMonth(1), lastDate, PeriodKind.MONTH_TO_DATE);
    }

    /**
     * Quarter containing {@code lastDate}, where quarter one starts in {@code quarterStartMonth}
     * (1 for calendar quarters, 10 for an October fiscal year).
     */
    public static PeriodWindow quarterToDate(LocalDate lastDate, int quarterStartMonth) {
        int monthsIntoQuarter = Math.floorMod(lastDate.getMonthValue() - quarterStartMonth, 3);
        return new PeriodWindow(lastDate.withDayOfMonth(1).minusMonths(monthsIntoQuarter), lastDate,
                PeriodKind.QUARTER_TO_DATE);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
