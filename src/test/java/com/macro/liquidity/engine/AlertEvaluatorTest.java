package com.macro.liquidity.engine;

import com.macro.liquidity.config.MonitoringSettings;
import com.macro.liquidity.model.AlertSeverity;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.LiquidityAlert;
import com.macro.liquidity.model.PeriodChange;
import com.macro.liquidity.model.RollingWindowSummary;
import com.macro.liquidity.model.SpikeAnalysis;
import com.macro.liquidity.model.SpikeSeverity;
import com.macro.liquidity.model.StressIndexResult;
import com.macro.liquidity.model.StressLevel;
import com.macro.liquidity.model.TemporalSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.macro.liquidity.model.MetricNames.SPREAD_SOFR_IORB;
import static com.macro.liquidity.model.MetricNames.SWAP_LINES;
import static com.macro.liquidity.testutil.TestSeriesFactory.createTable;
import static org.assertj.core.api.Assertions.assertThat;

class AlertEvaluatorTest {

    private AlertEvaluator evaluator;
    private AlignedTable table;

    @BeforeEach
    void setUp() {
        evaluator = new AlertEvaluator(MonitoringSettings.defaults());
        table = createTable(2, SWAP_LINES, new double[]{0, 0});
    }

    private static StressIndexResult stress(double score) {
        return StressIndexResult.builder().score(score).level(StressLevel.fromScore(score)).components(List.of()).build();
    }

    private static SpikeAnalysis spike(boolean flagged, SpikeSeverity severity) {
        return SpikeAnalysis.builder().column(SPREAD_SOFR_IORB).currentValue(15).spike(flagged).severity(severity).build();
    }

    private static TemporalSummary netLiquidityAtPercentile(double percentile) {
        return TemporalSummary.builder()
                .rolling3m(RollingWindowSummary.builder().percentileRank(percentile).build())
                .build();
    }

    @Test
    void calmConditions_raiseNoAlerts() {
        List<LiquidityAlert> alerts = evaluator.evaluate(table, stress(20), spike(false, SpikeSeverity.NORMAL),
                null, netLiquidityAtPercentile(50));

        assertThat(alerts).isEmpty();
    }

    @Test
    void stressLevels() {
        assertThat(evaluator.evaluate(table, stress(80), null, null, null))
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.getType()).isEqualTo("STRESS");
                    assertThat(a.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
                });
        assertThat(evaluator.evaluate(table, stress(55), null, null, null))
                .extracting(LiquidityAlert::getSeverity).containsExactly(AlertSeverity.WARNING);
    }

    @Test
    void spreadSpike_onlyWhenFlaggedAndSevere() {
        assertThat(evaluator.evaluate(table, null, spike(true, SpikeSeverity.WARNING), null, null))
                .extracting(LiquidityAlert::getType, LiquidityAlert::getSeverity)
                .containsExactly(org.assertj.core.groups.Tuple.tuple("SPREAD_SPIKE", AlertSeverity.WARNING));
        assertThat(evaluator.evaluate(table, null, spike(true, SpikeSeverity.NORMAL), null, null)).isEmpty();
        assertThat(evaluator.evaluate(table, null, spike(false, SpikeSeverity.CRITICAL), null, null)).isEmpty();
    }

    @Test
    void aggressiveRunoffPace() {
        TemporalSummary assets = TemporalSummary.builder()
                .quarterToDate(PeriodChange.builder().annualizedPace(-2_000_000.0).build())
                .build();

        assertThat(evaluator.evaluate(table, null, null, assets, null))
                .extracting(LiquidityAlert::getType).containsExactly("QT_PACE");
    }

    @Test
    void netLiquidityExtremes() {
        assertThat(evaluator.evaluate(table, null, null, null, netLiquidityAtPercentile(5)))
                .extracting(LiquidityAlert::getSeverity).containsExactly(AlertSeverity.WARNING);
        assertThat(evaluator.evaluate(table, null, null, null, netLiquidityAtPercentile(95)))
                .extracting(LiquidityAlert::getSeverity).containsExactly(AlertSeverity.INFO);
    }

    @Test
    void activeSwapLines_areCritical() {
        AlignedTable withSwaps = createTable(2, SWAP_LINES, new double[]{0, 5_000});

        assertThat(evaluator.evaluate(withSwaps, null, null, null, null))
                .extracting(LiquidityAlert::getType, LiquidityAlert::getSeverity)
                .containsExactly(org.assertj.core.groups.Tuple.tuple("SWAP_LINES", AlertSeverity.CRITICAL));
    }
}
