package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.engine.MetricDerivation;
import com.macro.liquidity.engine.MetricInputs;
import com.macro.liquidity.engine.SeriesMath;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * Running month-to-date column. {@link Mode#LEVEL} measures the level against the first
 * valid value of the month; {@link Mode#FLOW} accumulates a change column within the month.
 */
public class MonthToDateDerivation implements MetricDerivation {

    public enum Mode {
        LEVEL,
        FLOW
    }

    private final String source;
    private final String target;
    private final Mode mode;

    public MonthToDateDerivation(String source, String target, Mode mode) {
        this.source = source;
        this.target = target;
        this.mode = mode;
    }

    @Override
    public String getName() {
        return "mtd:" + target;
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(source);
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        double[] values = inputs.require(source);
        List<LocalDate> dates = inputs.dates();
        double[] out = SeriesMath.missing(values.length);

        YearMonth month = null;
        double anchor = Double.NaN;
        double running = 0.0;
        for (int i = 0; i < values.length; i++) {
            YearMonth current = YearMonth.from(dates.get(i));
            if (!current.equals(month)) {
                month = current;
                anchor = Double.NaN;
                running = 0.0;
            }
            if (Double.isNaN(values[i])) {
                continue;
            }
            if (mode == Mode.LEVEL) {
                if (Double.isNaN(anchor)) {
                    anchor = values[i];
                }
                out[i] = values[i] - anchor;
            } else {
                running += values[i];
                out[i] = running;
            }
        }
        return Map.of(target, out);
    }
}
