package com.macro.liquidity.engine;

/**
 * Percentage change against a period-start baseline reconstructed as {@code current - change}.
 */
public final class PercentChange {

    private PercentChange() {}

    /**
     * @return the change in percent, or 0 when the baseline is missing or not positive, or
     *         when the magnitude exceeds {@code maxAbsPct}
     */
    public static double of(double current, double change, double maxAbsPct) {
        double baseline = current - change;
        if (!Double.isFinite(baseline) || baseline <= 0) {
            return 0.0;
        }
        double pct = change / baseline * 100.0;
        if (!Double.isFinite(pct) || Math.abs(pct) > maxAbsPct) {
            return 0.0;
        }
        return pct;
    }
}
