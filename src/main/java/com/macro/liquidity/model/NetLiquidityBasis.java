package com.macro.liquidity.model;

/**
 * Which formula produced the reported net liquidity figure.
 */
public enum NetLiquidityBasis {
    /** Assets minus reverse-repo balance minus Treasury cash account. */
    FULL,
    /** Cash-account series unavailable; assets minus reverse-repo balance only. */
    EXCLUDES_TGA,
    UNAVAILABLE
}
