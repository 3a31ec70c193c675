package com.macro.liquidity.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SubIndexDefinition {
    String name;
    double weight;
    @Singular
    List<CompositeTerm> terms;
}
