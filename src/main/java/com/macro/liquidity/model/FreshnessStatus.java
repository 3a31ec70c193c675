package com.macro.liquidity.model;

public enum FreshnessStatus {
    OK,
    DELAYED,
    STALE
}
