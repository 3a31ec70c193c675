package com.macro.liquidity.engine.derivations;

import com.macro.liquidity.engine.MetricDerivation;
import com.macro.liquidity.engine.MetricInputs;
import com.macro.liquidity.engine.SeriesMath;

import java.util.List;
import java.util.Map;

public class YearOverYearDerivation implements MetricDerivation {

    private final String source;
    private final String target;
    private final int lag;

    public YearOverYearDerivation(String source, String target, int lag) {
        this.source = source;
        this.target = target;
        this.lag = lag;
    }

    @Override
    public String getName() {
        return "yoy:" + target;
    }

    @Override
    public List<String> getRequiredInputs() {
        return List.of(source);
    }

    @Override
    public Map<String, double[]> derive(MetricInputs inputs) {
        return Map.of(target, SeriesMath.diff(inputs.require(source), lag));
    }
}
