package com.macro.liquidity.config;

import com.macro.liquidity.model.MetricNames;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CompositeSettings {

    @Builder.Default
    List<SubIndexDefinition> subIndices = defaultSubIndices();

    @Builder.Default
    int fastWindow = 5;

    @Builder.Default
    int slowWindow = 20;

    /** Inclusive upper bounds of the VERY_TIGHT, TIGHT, NEUTRAL and EASY bands. */
    @Builder.Default
    double[] bandCutPoints = {-1.0, -0.5, 0.5, 1.0};

    public static CompositeSettings defaults() {
        return builder().build();
    }

    public static List<SubIndexDefinition> defaultSubIndices() {
        SubIndexDefinition fiscal = SubIndexDefinition.builder()
                .name("fiscal")
                .weight(0.40)
                .term(term(MetricNames.TGA_BALANCE, 0.40, TermTransform.NEGATED_CHANGE))
                .term(term(MetricNames.MA20_NET_IMPULSE, 0.35, TermTransform.LEVEL))
                .term(term(MetricNames.WITHHELD_TAX, 0.25, TermTransform.NEGATED_LEVEL))
                .build();
        SubIndexDefinition monetary = SubIndexDefinition.builder()
                .name("monetary")
                .weight(0.35)
                .term(term(MetricNames.NET_LIQUIDITY, 0.30, TermTransform.LEVEL))
                .term(term(MetricNames.NET_BALANCE_SHEET_FLOW, 0.25, TermTransform.LEVEL))
                .term(term(MetricNames.RRP_BALANCE, 0.20, TermTransform.NEGATED_CHANGE))
                .term(term(MetricNames.REPO_OPS_BALANCE, 0.15, TermTransform.LEVEL))
                .term(term(MetricNames.SPREAD_SOFR_IORB, 0.10, TermTransform.NEGATED_LEVEL))
                .build();
        SubIndexDefinition plumbing = SubIndexDefinition.builder()
                .name("plumbing")
                .weight(0.25)
                .term(term(MetricNames.REPO_SUBMISSION_RATIO, 0.40, TermTransform.NEGATED_LEVEL))
                .term(term(MetricNames.SETTLEMENT_FAILS, 0.30, TermTransform.NEGATED_LEVEL))
                .term(term(MetricNames.OFR_REPO_STRESS, 0.30, TermTransform.NEGATED_LEVEL))
                .build();
        return List.of(fiscal, monetary, plumbing);
    }

    private static CompositeTerm term(String column, double weight, TermTransform transform) {
        return CompositeTerm.builder().column(column).weight(weight).transform(transform).build();
    }
}
