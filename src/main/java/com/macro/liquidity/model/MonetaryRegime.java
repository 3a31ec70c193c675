package com.macro.liquidity.model;

public enum MonetaryRegime {
    QT,
    QE,
    NEUTRAL,
    UNKNOWN
}
