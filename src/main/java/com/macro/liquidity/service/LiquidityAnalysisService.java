package com.macro.liquidity.service;

import com.macro.liquidity.config.EngineMetrics;
import com.macro.liquidity.engine.AlertEvaluator;
import com.macro.liquidity.engine.CompositeIndexAggregator;
import com.macro.liquidity.engine.CorrelationCalculator;
import com.macro.liquidity.engine.DataFreshnessChecker;
import com.macro.liquidity.engine.FourWeekImpulseReconciler;
import com.macro.liquidity.engine.MetricsDeriver;
import com.macro.liquidity.engine.RecordPivot;
import com.macro.liquidity.engine.RegimeClassifier;
import com.macro.liquidity.engine.SeriesAligner;
import com.macro.liquidity.engine.SpikeDetector;
import com.macro.liquidity.engine.StressIndexEngine;
import com.macro.liquidity.engine.TemporalAggregator;
import com.macro.liquidity.engine.TrendForecaster;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.AnalysisRequest;
import com.macro.liquidity.model.AnalysisRun;
import com.macro.liquidity.model.CompositeIndexRecord;
import com.macro.liquidity.model.Column;
import com.macro.liquidity.model.FourWeekImpulseCheck;
import com.macro.liquidity.model.LiquidityAlert;
import com.macro.liquidity.model.LiquiditySummary;
import com.macro.liquidity.model.NetLiquidityBasis;
import com.macro.liquidity.model.RawSeries;
import com.macro.liquidity.model.RegimeAssessment;
import com.macro.liquidity.model.SeriesFrequency;
import com.macro.liquidity.model.SeriesPayload;
import com.macro.liquidity.model.SpikeAnalysis;
import com.macro.liquidity.model.StressIndexResult;
import com.macro.liquidity.model.TemporalSummary;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.macro.liquidity.model.MetricNames.*;

/**
 * Main orchestrator for one analysis run over a batch snapshot.
 *
 * Flow:
 * 1. Align raw series onto one date axis (SeriesAligner)
 * 2. Append derived metrics (MetricsDeriver)
 * 3. Summarize MTD / QTD / rolling 3M windows of the headline columns
 * 4. Detect spikes in the SOFR-IORB spread
 * 5. Score money-market stress and vote the monetary regime
 * 6. Build the composite liquidity index
 * 7. Forecast short-horizon trends and compute correlations
 * 8. Reconcile the four-week fiscal impulse, check data freshness, raise alerts
 */
@Service
public class LiquidityAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(LiquidityAnalysisService.class);

    private static final List<String> TEMPORAL_COLUMNS = List.of(
            NET_LIQUIDITY, NET_LIQUIDITY_NO_TGA, RRP_BALANCE, FED_TOTAL_ASSETS, TGA_BALANCE,
            SPREAD_SOFR_IORB, SPREAD_EFFR_IORB, REPO_OPS_BALANCE);

    private final SeriesAligner seriesAligner;
    private final MetricsDeriver metricsDeriver;
    private final TemporalAggregator temporalAggregator;
    private final SpikeDetector spikeDetector;
    private final StressIndexEngine stressIndexEngine;
    private final RegimeClassifier regimeClassifier;
    private final CompositeIndexAggregator compositeIndexAggregator;
    private final TrendForecaster trendForecaster;
    private final CorrelationCalculator correlationCalculator;
    private final FourWeekImpulseReconciler impulseReconciler;
    private final DataFreshnessChecker freshnessChecker;
    private final AlertEvaluator alertEvaluator;
    private final EngineMetrics engineMetrics;

    public LiquidityAnalysisService(SeriesAligner seriesAligner,
                                    MetricsDeriver metricsDeriver,
                                    TemporalAggregator temporalAggregator,
                                    SpikeDetector spikeDetector,
                                    StressIndexEngine stressIndexEngine,
                                    RegimeClassifier regimeClassifier,
                                    CompositeIndexAggregator compositeIndexAggregator,
                                    TrendForecaster trendForecaster,
                                    CorrelationCalculator correlationCalculator,
                                    FourWeekImpulseReconciler impulseReconciler,
                                    DataFreshnessChecker freshnessChecker,
                                    AlertEvaluator alertEvaluator,
                                    EngineMetrics engineMetrics) {
        this.seriesAligner = seriesAligner;
        this.metricsDeriver = metricsDeriver;
        this.temporalAggregator = temporalAggregator;
        this.spikeDetector = spikeDetector;
        this.stressIndexEngine = stressIndexEngine;
        this.regimeClassifier = regimeClassifier;
        this.compositeIndexAggregator = compositeIndexAggregator;
        this.trendForecaster = trendForecaster;
        this.correlationCalculator = correlationCalculator;
        this.impulseReconciler = impulseReconciler;
        this.freshnessChecker = freshnessChecker;
        this.alertEvaluator = alertEvaluator;
        this.engineMetrics = engineMetrics;
    }

    /**
     * Run the analysis for a request submitted over the API. Long records are pivoted into
     * one series per key and join the primary series.
     *
     * @throws IllegalArgumentException if a series name is missing or appears twice
     */
    @Observed(name = "liquidity.analysis", contextualName = "run-liquidity-analysis")
    public AnalysisRun analyze(AnalysisRequest request) {
        Map<String, RawSeries> series = toSeriesMap(request.getSeries());
        if (request.getRecords() != null && !request.getRecords().isEmpty()) {
            Map<String, RawSeries> pivoted = RecordPivot.pivot(request.getRecords(),
                    SeriesFrequency.fromLabel(request.getRecordFrequency()));
            log.debug("Pivoted {} records into series {}", request.getRecords().size(), pivoted.keySet());
            pivoted.forEach((name, raw) -> {
                if (series.putIfAbsent(name, raw) != null) {
                    throw new IllegalArgumentException("Duplicate series name: " + name);
                }
            });
        }
        return run(series, toSeriesMap(request.getSupplements()), request.getStartDate(), request.getReportDate());
    }

    /**
     * Run the full analysis.
     *
     * @param series      primary series keyed by column name
     * @param supplements faster sources that back-fill primary gaps, may be empty
     * @param startDate   first date kept in the table
     * @param reportDate  date used for freshness checks; null means the table's last date
     */
    public AnalysisRun analyze(Map<String, RawSeries> series, Map<String, RawSeries> supplements,
                               LocalDate startDate, LocalDate reportDate) {
        return run(series, supplements, startDate, reportDate);
    }

    private AnalysisRun run(Map<String, RawSeries> series, Map<String, RawSeries> supplements,
                            LocalDate startDate, LocalDate reportDate) {
        AlignedTable aligned = seriesAligner.align(series, supplements, startDate);
        List<String> placeholders = seriesAligner.missingRequired(series, supplements);

        MetricsDeriver.DerivationOutcome derived = metricsDeriver.derive(aligned);
        AlignedTable table = derived.table();
        derived.skipped().forEach(engineMetrics::recordSkippedDerivation);

        NetLiquidityBasis basis = netLiquidityBasis(table);
        Map<String, TemporalSummary> temporal = new LinkedHashMap<>();
        for (String column : TEMPORAL_COLUMNS) {
            if (table.column(column).filter(Column::hasAnyValue).isPresent()) {
                temporal.put(column, temporalAggregator.summarize(table, column));
            }
        }

        SpikeAnalysis spikes = spikeDetector.analyze(table, SPREAD_SOFR_IORB).orElse(null);
        StressIndexResult stress = stressIndexEngine.score(table);
        RegimeAssessment regime = regimeClassifier.classify(table);
        List<CompositeIndexRecord> composite = compositeIndexAggregator.aggregate(table);

        String impulseColumn = table.hasColumn(NET_IMPULSE) ? NET_IMPULSE : TOTAL_SPENDING;
        FourWeekImpulseCheck impulseCheck = impulseReconciler.reconcile(table, impulseColumn).orElse(null);
        if (impulseCheck != null && !impulseCheck.isWithinTolerance()) {
            log.warn("Four-week impulse definitions disagree for {}: sliding={} block={} diff={}",
                    impulseColumn, impulseCheck.getSlidingSum(), impulseCheck.getBlockSum(),
                    impulseCheck.getDifference());
        }

        LocalDate freshnessDate = reportDate != null ? reportDate : table.lastDate().orElse(startDate);
        List<LiquidityAlert> alerts = alertEvaluator.evaluate(table, stress, spikes,
                temporal.get(FED_TOTAL_ASSETS), temporal.get(NET_LIQUIDITY));

        LiquiditySummary summary = LiquiditySummary.builder()
                .asOf(table.lastDate().orElse(null))
                .rows(table.size())
                .netLiquidityBasis(basis)
                .temporal(temporal)
                .spreadSpikes(spikes)
                .stress(stress)
                .regime(regime)
                .correlations(correlationCalculator.correlate(table))
                .forecasts(trendForecaster.forecastAll(table))
                .fourWeekImpulse(impulseCheck)
                .freshness(freshnessChecker.check(series, freshnessDate))
                .alerts(alerts)
                .skippedDerivations(derived.skipped())
                .placeholderSeries(placeholders)
                .build();

        engineMetrics.recordRun(regime.getRegime().name(), basis.name());
        engineMetrics.recordStress(stress.getLevel().name(), stress.getScore());
        if (spikes != null && spikes.isSpike()) {
            engineMetrics.recordSpike(spikes.getColumn(), spikes.getSeverity().name());
        }
        alerts.forEach(a -> engineMetrics.recordAlert(a.getType(), a.getSeverity().name()));

        log.info("Liquidity analysis complete: rows={}, asOf={}, basis={}, stress={} ({}), regime={} ({}%), alerts={}",
                table.size(), summary.getAsOf(), basis, stress.getScore(), stress.getLevel(),
                regime.getRegime(), regime.getConfidence(), alerts.size());

        return AnalysisRun.builder()
                .table(table)
                .summary(summary)
                .compositeIndex(composite)
                .build();
    }

    private static NetLiquidityBasis netLiquidityBasis(AlignedTable table) {
        if (table.column(NET_LIQUIDITY).filter(Column::hasAnyValue).isPresent()) {
            return NetLiquidityBasis.FULL;
        }
        if (table.column(NET_LIQUIDITY_NO_TGA).filter(Column::hasAnyValue).isPresent()) {
            return NetLiquidityBasis.EXCLUDES_TGA;
        }
        return NetLiquidityBasis.UNAVAILABLE;
    }

    private static Map<String, RawSeries> toSeriesMap(List<SeriesPayload> payloads) {
        Map<String, RawSeries> series = new LinkedHashMap<>();
        if (payloads == null) {
            return series;
        }
        for (SeriesPayload payload : payloads) {
            RawSeries raw = payload.toRawSeries();
            if (series.putIfAbsent(raw.getName(), raw) != null) {
                throw new IllegalArgumentException("Duplicate series name: " + raw.getName());
            }
        }
        return series;
    }
}
