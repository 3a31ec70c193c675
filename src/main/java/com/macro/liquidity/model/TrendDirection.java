package com.macro.liquidity.model;

public enum TrendDirection {
    RISING("Rising"),
    DECLINING("Declining"),
    FLAT("Flat");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static TrendDirection fromSlope(double slope, double tolerance) {
        if (slope > tolerance) return RISING;
        if (slope < -tolerance) return DECLINING;
        return FLAT;
    }
}
