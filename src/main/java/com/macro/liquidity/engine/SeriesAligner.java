package com.macro.liquidity.engine;

import com.macro.liquidity.config.AlignmentSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.RawSeries;
import com.macro.liquidity.model.SeriesFrequency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges raw series of mixed frequency onto one ascending date axis.
 *
 * <p>Flow for every column:
 * <ol>
 *   <li>Place primary observations on the union of all observed dates</li>
 *   <li>Fill dates the primary is missing from a faster supplementary source of the same name</li>
 *   <li>Gap-fill by frequency: weekly and policy-driven series carry forward indefinitely,
 *       daily series only within {@link AlignmentSettings#getDailyFillLimitDays()} calendar days</li>
 *   <li>Drop rows before the start date</li>
 * </ol>
 * Required series that no source delivered become all-missing placeholder columns.
 */
public class SeriesAligner {

    private static final Logger log = LoggerFactory.getLogger(SeriesAligner.class);

    private final AlignmentSettings settings;

    public SeriesAligner(AlignmentSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public AlignedTable align(Map<String, RawSeries> primary, LocalDate startDate) {
        return align(primary, Map.of(), startDate);
    }

    /**
     * @param primary     series keyed by column name
     * @param supplements faster sources keyed by the primary column they back-fill
     * @param startDate   first date kept in the output
     */
    public AlignedTable align(Map<String, RawSeries> primary, Map<String, RawSeries> supplements,
                              LocalDate startDate) {
        if (primary == null) {
            throw new IllegalArgumentException("Primary series map must not be null");
        }
        if (startDate == null) {
            throw new IllegalArgumentException("Start date must not be null");
        }
        Map<String, RawSeries> secondary = supplements != null ? supplements : Map.of();

        TreeSet<LocalDate> axis = new TreeSet<>();
        primary.values().forEach(s -> axis.addAll(s.getObservations().keySet()));
        secondary.values().forEach(s -> axis.addAll(s.getObservations().keySet()));
        List<LocalDate> dates = new ArrayList<>(axis);

        Set<String> names = new LinkedHashSet<>(primary.keySet());
        names.addAll(secondary.keySet());

        int startIndex = firstIndexOnOrAfter(dates, startDate);
        AlignedTable table = new AlignedTable(dates.subList(startIndex, dates.size()));

        for (String name : names) {
            RawSeries main = primary.get(name);
            RawSeries backup = secondary.get(name);
            double[] values = place(main != null ? main : backup, dates);
            if (main != null && backup != null) {
                int filled = backFill(values, backup, dates);
                if (filled > 0) {
                    log.debug("Filled {} missing dates of {} from supplementary source", filled, name);
                }
            }
            SeriesFrequency frequency = main != null ? main.getFrequency() : backup.getFrequency();
            double[] gapFilled = fillGaps(values, dates, frequency);
            table.putColumn(name, Arrays.copyOfRange(gapFilled, startIndex, gapFilled.length));
        }

        for (String required : missingRequired(primary, secondary)) {
            log.warn("Required series {} is absent; adding an all-missing placeholder column", required);
            table.putColumn(required, SeriesMath.missing(table.size()));
        }

        log.info("Aligned {} series onto {} dates from {} ({} dropped before start)",
                names.size(), table.size(), startDate, startIndex);
        return table;
    }

    /** Required series that neither a primary nor a supplementary source delivered. */
    public List<String> missingRequired(Map<String, RawSeries> primary, Map<String, RawSeries> supplements) {
        List<String> missing = new ArrayList<>();
        for (String required : settings.getRequiredSeries()) {
            if (!primary.containsKey(required) && (supplements == null || !supplements.containsKey(required))) {
                missing.add(required);
            }
        }
        return missing;
    }

    double[] fillGaps(double[] values, List<LocalDate> dates, SeriesFrequency frequency) {
        switch (frequency) {
            case WEEKLY:
            case POLICY_DRIVEN:
                return SeriesMath.forwardFill(values);
            case DAILY:
                return boundedFill(values, dates, settings.getDailyFillLimitDays());
            default:
                return values;
        }
    }

    private static double[] place(RawSeries series, List<LocalDate> dates) {
        double[] values = SeriesMath.missing(dates.size());
        for (int i = 0; i < dates.size(); i++) {
            Double value = series.getObservations().get(dates.get(i));
            if (value != null) {
                values[i] = value;
            }
        }
        return values;
    }

    private static int backFill(double[] values, RawSeries backup, List<LocalDate> dates) {
        int filled = 0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                Double value = backup.getObservations().get(dates.get(i));
                if (value != null) {
                    values[i] = value;
                    filled++;
                }
            }
        }
        return filled;
    }

    /** Forward fill that stops once the gap since the last real observation exceeds {@code limitDays}. */
    private static double[] boundedFill(double[] values, List<LocalDate> dates, int limitDays) {
        double[] out = Arrays.copyOf(values, values.length);
        LocalDate lastObserved = null;
        double lastValue = Double.NaN;
        for (int i = 0; i < out.length; i++) {
            if (!Double.isNaN(values[i])) {
                lastObserved = dates.get(i);
                lastValue = values[i];
            } else if (lastObserved != null
                    && ChronoUnit.DAYS.between(lastObserved, dates.get(i)) <= limitDays) {
                out[i] = lastValue;
            }
        }
        return out;
    }

    private static int firstIndexOnOrAfter(List<LocalDate> dates, LocalDate startDate) {
        for (int i = 0; i < dates.size(); i++) {
            if (!dates.get(i).isBefore(startDate)) return i;
        }
        return dates.size();
    }
}
