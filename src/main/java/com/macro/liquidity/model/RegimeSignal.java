package com.macro.liquidity.model;

/**
 * Directional vote cast by one regime detector. QT and TIGHTENING pool together,
 * as do QE and EASING; NEUTRAL only counts toward the total.
 */
public enum RegimeSignal {
    QT,
    QE,
    NEUTRAL,
    TIGHTENING,
    EASING;

    public boolean isContractionary() {
        return this == QT || this == TIGHTENING;
    }

    public boolean isExpansionary() {
        return this == QE || this == EASING;
    }
}
