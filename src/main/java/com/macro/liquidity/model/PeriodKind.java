package com.macro.liquidity.model;

public enum PeriodKind {
    MONTH_TO_DATE,
    QUARTER_TO_DATE,
    ROLLING
}
