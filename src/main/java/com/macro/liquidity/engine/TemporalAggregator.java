package com.macro.liquidity.engine;

import com.macro.liquidity.config.TemporalSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.Column;
import com.macro.liquidity.model.PeriodChange;
import com.macro.liquidity.model.PeriodKind;
import com.macro.liquidity.model.PeriodWindow;
import com.macro.liquidity.model.RollingWindowSummary;
import com.macro.liquidity.model.TemporalSummary;
import com.macro.liquidity.model.TrendDirection;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Month-to-date, quarter-to-date and rolling-window summaries anchored to the table's
 * last date. Windows are recomputed on every call.
 */
public class TemporalAggregator {

    private final TemporalSettings settings;

    public TemporalAggregator(TemporalSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public TemporalSummary summarize(AlignedTable table, String column) {
        return TemporalSummary.builder()
                .column(column)
                .monthToDate(periodChange(table, column, PeriodKind.MONTH_TO_DATE).orElse(null))
                .quarterToDate(periodChange(table, column, PeriodKind.QUARTER_TO_DATE).orElse(null))
                .rolling3m(rolling(table, column).orElse(null))
                .build();
    }

    public PeriodWindow window(LocalDate lastDate, PeriodKind kind) {
        switch (kind) {
            case MONTH_TO_DATE:
                return PeriodWindow.monthToDate(lastDate);
            case QUARTER_TO_DATE:
                return PeriodWindow.quarterToDate(lastDate, settings.getQuarterStartMonth());
            default:
                throw new IllegalArgumentException("Rolling windows are defined by session count, not by date: " + kind);
        }
    }

    /**
     * Change between the first and last valid observations inside the window. Empty when
     * the column is absent or has no valid value in the window.
     */
    public Optional<PeriodChange> periodChange(AlignedTable table, String column, PeriodKind kind) {
        Optional<LocalDate> lastDate = table.lastDate();
        Optional<Column> values = table.column(column);
        if (lastDate.isEmpty() || values.isEmpty()) {
            return Optional.empty();
        }
        PeriodWindow window = window(lastDate.get(), kind);
        int from = firstRowOnOrAfter(table, window.getStart());
        int to = table.size();

        Column col = values.get();
        OptionalInt first = col.firstValidIndex(from, to);
        OptionalInt last = col.lastValidIndex(from, to);
        if (first.isEmpty()) {
            return Optional.empty();
        }

        double[] valid = SeriesMath.validSlice(col.toArray(), from, to);
        double firstValue = col.get(first.getAsInt());
        double lastValue = col.get(last.getAsInt());
        double change = lastValue - firstValue;
        int sessions = to - from;

        PeriodChange.PeriodChangeBuilder builder = PeriodChange.builder()
                .column(column)
                .window(window)
                .firstValue(firstValue)
                .lastValue(lastValue)
                .change(change)
                .changePct(PercentChange.of(lastValue, change, settings.getMaxAbsPercentChange()))
                .average(SeriesMath.mean(valid))
                .min(min(valid))
                .max(max(valid))
                .sessions(sessions);
        if (kind == PeriodKind.QUARTER_TO_DATE) {
            builder.annualizedPace(change / sessions * settings.getSessionsPerYear());
        }
        return Optional.of(builder.build());
    }

    /**
     * Statistics over the trailing rolling window. Empty when the table is shorter than the
     * window, the current value is missing, or the column has fewer valid observations in the
     * window than {@link TemporalSettings#rollingMinValid()}, so a short history never yields
     * a biased rank.
     */
    public Optional<RollingWindowSummary> rolling(AlignedTable table, String column) {
        int window = settings.getRollingWindow();
        Optional<Column> values = table.column(column);
        if (table.size() < window || values.isEmpty()) {
            return Optional.empty();
        }
        Column col = values.get();
        if (col.latest().isEmpty()) {
            return Optional.empty();
        }
        int from = table.size() - window;
        double current = col.latest().getAsDouble();
        double[] valid = SeriesMath.validSlice(col.toArray(), from, table.size());
        if (valid.length < settings.rollingMinValid()) {
            return Optional.empty();
        }

        int below = 0;
        for (double v : valid) {
            if (v < current) below++;
        }
        double std = SeriesMath.sampleStd(valid);
        double slope = valid.length >= 2 ? SeriesMath.fitLine(valid).slope() : 0.0;

        return Optional.of(RollingWindowSummary.builder()
                .column(column)
                .window(new PeriodWindow(table.dateAt(from), table.lastDate().orElseThrow(), PeriodKind.ROLLING))
                .current(current)
                .average(SeriesMath.mean(valid))
                .std(Double.isNaN(std) ? null : std)
                .percentileRank((double) below / valid.length * 100.0)
                .slope(slope)
                .trend(TrendDirection.fromSlope(slope, settings.trendSlopeThresholdFor(column)))
                .build());
    }

    private static int firstRowOnOrAfter(AlignedTable table, LocalDate date) {
        for (int i = 0; i < table.size(); i++) {
            if (!table.dateAt(i).isBefore(date)) return i;
        }
        return table.size();
    }

    private static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) min = Math.min(min, v);
        return min;
    }

    private static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) max = Math.max(max, v);
        return max;
    }
}
