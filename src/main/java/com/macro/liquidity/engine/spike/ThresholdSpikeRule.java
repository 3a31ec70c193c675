package com.macro.liquidity.engine.spike;

/**
 * Value above rolling mean + k * rolling std.
 */
public class ThresholdSpikeRule implements SpikeRule {

    @Override
    public String getName() {
        return "THRESHOLD";
    }

    @Override
    public boolean isSpike(SpikeContext context, int index) {
        double upper = context.thresholdUpper(index);
        return !Double.isNaN(upper) && context.value(index) > upper;
    }
}
