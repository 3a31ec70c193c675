package com.macro.liquidity.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompositeTerm {
    String column;
    double weight;
    @Builder.Default
    TermTransform transform = TermTransform.LEVEL;
}
