package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.config.SpreadDefinition;
import com.macro.liquidity.engine.MetricDerivation;
import com.macro.liquidity.engine.MetricInputs;

import java.util.List;
import java.util.Map;

/**
 * One rate spread. A missing leg on a date gives a missing spread, not zero.
 */
public class SpreadDerivation implements MetricDerivation {

    private final SpreadDefinition definition;

    public SpreadDerivation(SpreadDefinition definition) {
        this.definition = definition;
    }

    @Override
    public String getName() {
        return "spread:" + definition.getName();
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(definition.getMinuend(), definition.getSubtrahend());
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        double[] a = inputs.require(definition.getMinuend());
        double[] b = inputs.require(definition.getSubtrahend());
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = (a[i] - b[i]) * definition.getMultiplier();
        }
        return Map.of(definition.getName(), out);
    }
}
