package com.macro.liquidity.config;

import lombok.Builder;
import lombok.Value;

/**
 * {@code name = (minuend - subtrahend) * multiplier}. Rate spreads use 100 (percent to bps),
 * curve spreads stay in percent with 1.
 */
@Value
@Builder
public class SpreadDefinition {
    String name;
    String minuend;
    String subtrahend;
    @Builder.Default
    double multiplier = 100.0;
}
