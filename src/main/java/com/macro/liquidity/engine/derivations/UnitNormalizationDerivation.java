package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.engine.MetricDerivation;
import com.macro.liquidity.engine.MetricInputs;
import com.macro.liquidity.engine.SeriesMath;

import java.util.List;
import java.util.Map;

/**
 * Rescales a column into millions so it can be combined with other balances.
 */
public class UnitNormalizationDerivation implements MetricDerivation {

    private final String source;
    private final String target;
    private final double factor;

    public UnitNormalizationDerivation(String source, String target, double factor) {
        this.source = source;
        this.target = target;
        this.factor = factor;
    }

    @Override
    public String getName() {
        return "unit:" + target;
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(source);
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        return Map.of(target, SeriesMath.scale(inputs.require(source), factor));
    }
}
