package com.macro.liquidity.model;

public enum StressLevel {
    LOW,
    MODERATE,
    ELEVATED,
    HIGH_STRESS;

    public static StressLevel fromScore(double score) {
        return fromScore(score, 25, 50, 75);
    }

    public static StressLevel fromScore(double score, double moderateAt, double elevatedAt, double highAt) {
        if (score >= highAt) return HIGH_STRESS;
        if (score >= elevatedAt) return ELEVATED;
        if (score >= moderateAt) return MODERATE;
        return LOW;
    }
}
