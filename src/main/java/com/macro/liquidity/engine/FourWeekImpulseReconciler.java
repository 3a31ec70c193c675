package com.macro.liquidity.engine;

import com.macro.liquidity.config.MonitoringSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.Column;
import com.macro.liquidity.model.FourWeekImpulseCheck;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;

/**
 * Compares the two four-week impulse definitions in use: a sliding sum of the last
 * {@code sessions} rows, and a block sum of the four most recent Monday-to-Friday weeks
 * ending at the table's last date. Neither is treated as authoritative; the check reports
 * both and whether they agree within tolerance.
 */
public class FourWeekImpulseReconciler {

    private final MonitoringSettings settings;
    private final int sessions;

    public FourWeekImpulseReconciler(MonitoringSettings settings, int sessions) {
        this.settings = settings;
        this.sessions = sessions;
    }

    public Optional<FourWeekImpulseCheck> reconcile(AlignedTable table, String column) {
        Optional<Column> source = table.column(column);
        if (source.isEmpty() || table.size() < sessions || table.lastDate().isEmpty()) {
            return Optional.empty();
        }
        Column col = source.get();
        if (col.latest().isEmpty()) {
            return Optional.empty();
        }

        double sliding = sum(SeriesMath.validSlice(col.toArray(), table.size() - sessions, table.size()));

        LocalDate lastDate = table.lastDate().get();
        LocalDate blockStart = lastDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(3);
        double block = 0.0;
        for (int i = 0; i < table.size(); i++) {
            LocalDate date = table.dateAt(i);
            if (date.isBefore(blockStart) || !col.isValid(i) || isWeekend(date)) continue;
            block += col.get(i);
        }

        double difference = block - sliding;
        Double differencePct = sliding == 0.0 ? null : Math.abs(difference) / Math.abs(sliding) * 100.0;
        boolean within = Math.abs(difference) <= settings.getImpulseToleranceAbs()
                && (differencePct == null || differencePct <= settings.getImpulseTolerancePct());

        return Optional.of(FourWeekImpulseCheck.builder()
                .column(column)
                .asOf(lastDate)
                .slidingSum(sliding)
                .blockSum(block)
                .difference(difference)
                .differencePct(differencePct)
                .withinTolerance(within)
                .build());
    }

    private static boolean isWeekend(LocalDate date) {
        return date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY;
    }

    private static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) total += v;
        return total;
    }
}
