package com.macro.liquidity.engine.spike;

/**
 * One independent spike test. Rules are combined with logical OR.
 */
public interface SpikeRule {

    String getName();

    /**
     * @return true when observation {@code index} is anomalous under this rule;
     *         false when the rule cannot be evaluated there
     */
    boolean isSpike(SpikeContext context, int index);
}
