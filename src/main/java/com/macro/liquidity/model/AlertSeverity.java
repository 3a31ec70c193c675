package com.macro.liquidity.model;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
