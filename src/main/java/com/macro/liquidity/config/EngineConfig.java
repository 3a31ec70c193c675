package com.macro.liquidity.config;

import com.macro.liquidity.engine.AlertEvaluator;
import com.macro.liquidity.engine.CompositeIndexAggregator;
import com.macro.liquidity.engine.CorrelationCalculator;
import com.macro.liquidity.engine.DataFreshnessChecker;
import com.macro.liquidity.engine.FourWeekImpulseReconciler;
import com.macro.liquidity.engine.MetricsDeriver;
import com.macro.liquidity.engine.RegimeClassifier;
import com.macro.liquidity.engine.SeriesAligner;
import com.macro.liquidity.engine.SpikeDetector;
import com.macro.liquidity.engine.StressIndexEngine;
import com.macro.liquidity.engine.TemporalAggregator;
import com.macro.liquidity.engine.TrendForecaster;
import com.macro.liquidity.engine.derivations.StandardDerivations;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine components with immutable settings taken from
 * {@link LiquidityEngineProperties} at startup.
 */
@Configuration
public class EngineConfig {

    @Bean
    public SeriesAligner seriesAligner(LiquidityEngineProperties properties) {
        return new SeriesAligner(properties.getAlignment().toSettings());
    }

    @Bean
    public MetricsDeriver metricsDeriver(LiquidityEngineProperties properties) {
        return new MetricsDeriver(StandardDerivations.create(properties.getDerivation().toSettings()));
    }

    @Bean
    public TemporalAggregator temporalAggregator(LiquidityEngineProperties properties) {
        return new TemporalAggregator(properties.getTemporal().toSettings());
    }

    @Bean
    public SpikeDetector spikeDetector(LiquidityEngineProperties properties) {
        return new SpikeDetector(properties.getSpike().toSettings(),
                properties.getTemporal().getQuarterStartMonth());
    }

    @Bean
    public StressIndexEngine stressIndexEngine(LiquidityEngineProperties properties) {
        return new StressIndexEngine(properties.getStress().toSettings());
    }

    @Bean
    public RegimeClassifier regimeClassifier(LiquidityEngineProperties properties) {
        return new RegimeClassifier(properties.getRegime().toSettings());
    }

    @Bean
    public CompositeIndexAggregator compositeIndexAggregator(LiquidityEngineProperties properties) {
        return new CompositeIndexAggregator(properties.getComposite().toSettings());
    }

    @Bean
    public TrendForecaster trendForecaster(LiquidityEngineProperties properties) {
        return new TrendForecaster(properties.getForecast().toSettings());
    }

    @Bean
    public CorrelationCalculator correlationCalculator(LiquidityEngineProperties properties) {
        return new CorrelationCalculator(properties.getMonitoring().toSettings());
    }

    @Bean
    public FourWeekImpulseReconciler fourWeekImpulseReconciler(LiquidityEngineProperties properties) {
        return new FourWeekImpulseReconciler(properties.getMonitoring().toSettings(),
                properties.getDerivation().getFourWeekSessions());
    }

    @Bean
    public DataFreshnessChecker dataFreshnessChecker(LiquidityEngineProperties properties) {
        return new DataFreshnessChecker(properties.getMonitoring().toSettings());
    }

    @Bean
    public AlertEvaluator alertEvaluator(LiquidityEngineProperties properties) {
        return new AlertEvaluator(properties.getMonitoring().toSettings());
    }
}
