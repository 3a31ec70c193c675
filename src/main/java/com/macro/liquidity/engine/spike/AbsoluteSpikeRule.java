package com.macro.liquidity.engine.spike;

/**
 * Value above a fixed level. Spreads are stored in bps, so the threshold is compared as is.
 */
public class AbsoluteSpikeRule implements SpikeRule {

    @Override
    public String getName() {
        return "ABSOLUTE";
    }

    @Override
    public boolean isSpike(SpikeContext context, int index) {
        return context.value(index) > context.getSettings().getAbsoluteThresholdBps();
    }
}
