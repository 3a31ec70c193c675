package com.macro.liquidity.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class EngineMetrics {

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String regime, String netLiquidityBasis) {
        Counter.builder("liquidity.analysis.count")
                .tag("regime", regime)
                .tag("net_liquidity_basis", netLiquidityBasis)
                .register(registry)
                .increment();
    }

    public void recordStress(String level, double score) {
        DistributionSummary.builder("liquidity.stress.score")
                .tag("level", level)
                .register(registry)
                .record(score);
    }

    public void recordSpike(String column, String severity) {
        Counter.builder("liquidity.spike.count")
                .tag("column", column)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordSkippedDerivation(String derivation) {
        Counter.builder("liquidity.derivation.skipped.count")
                .tag("derivation", derivation)
                .register(registry)
                .increment();
    }

    public void recordAlert(String type, String severity) {
        Counter.builder("liquidity.alert.count")
                .tag("type", type)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }
}
