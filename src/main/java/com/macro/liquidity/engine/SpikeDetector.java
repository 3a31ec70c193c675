package com.macro.liquidity.engine;

import com.macro.liquidity.config.SpikeSettings;
import com.macro.liquidity.engine.spike.AbsoluteSpikeRule;
import com.macro.liquidity.engine.spike.PercentileSpikeRule;
import com.macro.liquidity.engine.spike.SpikeContext;
import com.macro.liquidity.engine.spike.SpikeRule;
import com.macro.liquidity.engine.spike.ThresholdSpikeRule;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.Column;
import com.macro.liquidity.model.PeriodWindow;
import com.macro.liquidity.model.SpikeAnalysis;
import com.macro.liquidity.model.SpikeSeverity;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags anomalous values of a spread series. Statistics run over the valid observations
 * only, so calendar gaps do not dilute the rolling windows.
 */
public class SpikeDetector {

    private final SpikeSettings settings;
    private final int quarterStartMonth;
    private final List<SpikeRule> rules;

    public SpikeDetector(SpikeSettings settings) {
        this(settings, 1);
    }

    public SpikeDetector(SpikeSettings settings, int quarterStartMonth) {
        this(settings, quarterStartMonth,
                List.of(new ThresholdSpikeRule(), new AbsoluteSpikeRule(), new PercentileSpikeRule()));
    }

    public SpikeDetector(SpikeSettings settings, int quarterStartMonth, List<SpikeRule> rules) {
        this.settings = settings;
        this.quarterStartMonth = quarterStartMonth;
        this.rules = List.copyOf(rules);
    }

    public Optional<SpikeAnalysis> analyze(AlignedTable table, String column) {
        Optional<Column> source = table.column(column);
        if (source.isEmpty()) {
            return Optional.empty();
        }

        List<LocalDate> dates = new ArrayList<>();
        List<Double> observed = new ArrayList<>();
        Column col = source.get();
        for (int i = 0; i < col.size(); i++) {
            if (col.isValid(i)) {
                dates.add(table.dateAt(i));
                observed.add(col.get(i));
            }
        }
        if (observed.size() < settings.getMinObservations()) {
            return Optional.empty();
        }

        double[] values = observed.stream().mapToDouble(Double::doubleValue).toArray();
        SpikeContext context = new SpikeContext(values, settings);
        int last = values.length - 1;
        LocalDate lastDate = dates.get(last);
        LocalDate monthStart = PeriodWindow.monthToDate(lastDate).getStart();
        LocalDate quarterStart = PeriodWindow.quarterToDate(lastDate, quarterStartMonth).getStart();

        int mtd = 0;
        int qtd = 0;
        for (int i = 0; i < values.length; i++) {
            if (!dates.get(i).isBefore(quarterStart) && isSpike(context, i)) {
                qtd++;
                if (!dates.get(i).isBefore(monthStart)) mtd++;
            }
        }

        List<String> triggered = new ArrayList<>();
        for (SpikeRule rule : rules) {
            if (rule.isSpike(context, last)) triggered.add(rule.getName());
        }

        int maxIndex = Math.max(0, values.length - settings.getPercentileWindow());
        for (int i = maxIndex; i < values.length; i++) {
            if (values[i] > values[maxIndex]) maxIndex = i;
        }

        double mean = context.mean(last);
        double std = context.std(last);
        double upper = context.thresholdUpper(last);
        return Optional.of(SpikeAnalysis.builder()
                .column(column)
                .asOf(lastDate)
                .currentValue(values[last])
                .spike(!triggered.isEmpty())
                .triggeredRules(triggered)
                .severity(SpikeSeverity.fromDeviation(values[last], mean, std))
                .movingAverage(Double.isNaN(mean) ? null : mean)
                .thresholdUpper(Double.isNaN(upper) ? null : upper)
                .mtdSpikeCount(mtd)
                .qtdSpikeCount(qtd)
                .max3m(values[maxIndex])
                .max3mDate(dates.get(maxIndex))
                .build());
    }

    private boolean isSpike(SpikeContext context, int index) {
        for (SpikeRule rule : rules) {
            if (rule.isSpike(context, index)) return true;
        }
        return false;
    }
}
