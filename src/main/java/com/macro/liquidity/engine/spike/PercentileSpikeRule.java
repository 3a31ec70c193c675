package com.macro.liquidity.engine.spike;

/**
 * Value above the rolling upper percentile of the trailing ~3 months.
 */
public class PercentileSpikeRule implements SpikeRule {

    @Override
    public String getName() {
        return "PERCENTILE";
    }

    @Override
    public boolean isSpike(SpikeContext context, int index) {
        double upper = context.upperPercentile(index);
        return !Double.isNaN(upper) && context.value(index) > upper;
    }
}
