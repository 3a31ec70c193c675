package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.engine.MetricDerivation;
import com.macro.liquidity.engine.MetricInputs;
import com.macro.liquidity.engine.SeriesMath;

import java.util.List;
import java.util.Map;

/**
 * Trailing mean that tolerates sparse windows: a value is produced once
 * {@code minPeriods} valid observations are inside the window.
 */
public class MovingAverageDerivation implements MetricDerivation {

    private final String source;
    private final String target;
    private final int window;
    private final int minPeriods;

    public MovingAverageDerivation(String source, String target, int window, int minPeriods) {
        this.source = source;
        this.target = target;
        this.window = window;
        this.minPeriods = minPeriods;
    }

    @Override
    public String getName() {
        return "ma:" + target;
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(source);
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        return Map.of(target, SeriesMath.rollingMean(inputs.require(source), window, minPeriods));
    }
}
