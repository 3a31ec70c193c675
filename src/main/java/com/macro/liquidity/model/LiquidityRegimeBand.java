package com.macro.liquidity.model;

/**
 * Discrete band of the raw composite liquidity index. Upper bounds are inclusive.
 */
public enum LiquidityRegimeBand {
    VERY_TIGHT("Very Tight"),
    TIGHT("Tight"),
    NEUTRAL("Neutral"),
    EASY("Easy"),
    VERY_EASY("Very Easy");

    private final String label;

    LiquidityRegimeBand(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @param cutPoints four ascending upper bounds for VERY_TIGHT, TIGHT, NEUTRAL and EASY
     */
    public static LiquidityRegimeBand fromComposite(double value, double[] cutPoints) {
        if (Double.isNaN(value)) return null;
        LiquidityRegimeBand[] bands = values();
        for (int i = 0; i < cutPoints.length && i < bands.length - 1; i++) {
            if (value <= cutPoints[i]) return bands[i];
        }
        return VERY_EASY;
    }
}
