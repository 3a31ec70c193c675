package com.macro.liquidity.model;

/**
 * Publication cadence of a raw series. Drives the gap-filling policy applied when
 * series are merged onto a common date axis.
 */
public enum SeriesFrequency {
    DAILY,
    WEEKLY,
    POLICY_DRIVEN,
    UNKNOWN;

    public static SeriesFrequency fromLabel(String label) {
        if (label == null || label.isBlank()) return UNKNOWN;
        switch (label.trim().toLowerCase()) {
            case "daily":
                return DAILY;
            case "weekly":
                return WEEKLY;
            case "policy":
            case "policy-driven":
            case "policy_driven":
                return POLICY_DRIVEN;
            default:
                return UNKNOWN;
        }
    }
}
