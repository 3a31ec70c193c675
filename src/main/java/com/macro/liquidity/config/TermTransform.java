package com.macro.liquidity.config;

/**
 * Signed transform applied to a raw column before z-scoring, chosen so that a positive
 * result means liquidity is being added.
 */
public enum TermTransform {
    LEVEL,
    NEGATED_LEVEL,
    CHANGE,
    NEGATED_CHANGE
}
