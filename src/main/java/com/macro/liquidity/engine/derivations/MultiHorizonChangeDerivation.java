package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.config.DerivationSettings;
import com.macro.liquidity.engine.MetricDerivation;
import com.macro.liquidity.engine.MetricInputs;
import com.macro.liquidity.engine.SeriesMath;
import com.macro.liquidity.model.MetricNames;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 1, 5, 22 and 65 session changes of a flow-relevant column. The daily change uses the
 * column as published; the longer horizons use a forward-filled copy so a holiday does
 * not turn into a spurious zero or missing delta.
 */
public class MultiHorizonChangeDerivation implements MetricDerivation {

    private final String source;
    private final String prefix;
    private final DerivationSettings settings;

    public MultiHorizonChangeDerivation(String source, String prefix, DerivationSettings settings) {
        this.source = source;
        this.prefix = prefix;
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "changes:" + prefix;
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(source);
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        double[] raw = inputs.require(source);
        double[] filled = SeriesMath.forwardFill(raw);

        Map<String, double[]> out = new LinkedHashMap<>();
        out.put(prefix + "_Change", SeriesMath.diff(raw, 1));
        out.put(MetricNames.weeklyChange(prefix), SeriesMath.diff(filled, settings.getWeeklyLag()));
        out.put(MetricNames.monthlyChange(prefix), SeriesMath.diff(filled, settings.getMonthlyLag()));
        out.put(MetricNames.quarterlyChange(prefix), SeriesMath.diff(filled, settings.getQuarterlyLag()));
        return out;
    }
}
