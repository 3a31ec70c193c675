package com.macro.liquidity.model;

public enum SpikeSeverity {
    NORMAL,
    ELEVATED,
    WARNING,
    CRITICAL;

    /**
     * Sigma bands above the rolling mean. Independent of whether any spike rule fired.
     */
    public static SpikeSeverity fromDeviation(double value, double mean, double std) {
        if (Double.isNaN(mean) || Double.isNaN(std)) return NORMAL;
        if (value > mean + 3 * std) return CRITICAL;
        if (value > mean + 2 * std) return WARNING;
        if (value > mean + std) return ELEVATED;
        return NORMAL;
    }
}
