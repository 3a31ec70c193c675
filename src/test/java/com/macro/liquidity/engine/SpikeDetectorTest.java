package com.macro.liquidity.engine;

import com.macro.liquidity.config.SpikeSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.SpikeAnalysis;
import com.macro.liquidity.model.SpikeSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.macro.liquidity.model.MetricNames.SPREAD_SOFR_IORB;
import static com.macro.liquidity.testutil.TestSeriesFactory.constant;
import static com.macro.liquidity.testutil.TestSeriesFactory.createTable;
import static org.assertj.core.api.Assertions.assertThat;

class SpikeDetectorTest {

    private SpikeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new SpikeDetector(SpikeSettings.defaults());
    }

    @Test
    void tooFewObservations_returnsEmpty() {
        AlignedTable table = createTable(19, SPREAD_SOFR_IORB, constant(19, 1.0));

        assertThat(detector.analyze(table, SPREAD_SOFR_IORB)).isEmpty();
        assertThat(detector.analyze(table, "Missing_Column")).isEmpty();
    }

    @Test
    void gapsDoNotCountTowardsMinimumObservations() {
        double[] values = constant(30, 1.0);
        for (int i = 0; i < 30; i += 2) values[i] = Double.NaN;
        AlignedTable table = createTable(30, SPREAD_SOFR_IORB, values);

        assertThat(detector.analyze(table, SPREAD_SOFR_IORB)).isEmpty();
    }

    @Test
    void jumpAboveBand_triggersThresholdAndAbsolute() {
        double[] values = new double[30];
        for (int i = 0; i < 29; i++) values[i] = i % 2 == 0 ? 1.0 : 2.0;
        values[29] = 12.0;
        AlignedTable table = createTable(30, SPREAD_SOFR_IORB, values);

        SpikeAnalysis analysis = detector.analyze(table, SPREAD_SOFR_IORB).orElseThrow();

        assertThat(analysis.isSpike()).isTrue();
        assertThat(analysis.getTriggeredRules()).containsExactly("THRESHOLD", "ABSOLUTE");
        assertThat(analysis.getSeverity()).isEqualTo(SpikeSeverity.CRITICAL);
        assertThat(analysis.getCurrentValue()).isEqualTo(12.0);
        assertThat(analysis.getMax3m()).isEqualTo(12.0);
        assertThat(analysis.getMax3mDate()).isEqualTo(table.lastDate().orElseThrow());
        assertThat(analysis.getQtdSpikeCount()).isEqualTo(1);
        assertThat(analysis.getMtdSpikeCount()).isEqualTo(1);
    }

    @Test
    void absoluteRuleCanFireWhileSeverityStaysNormal() {
        double[] values = new double[30];
        for (int i = 0; i < 30; i++) values[i] = i % 2 == 0 ? 11.2 : 11.0;
        AlignedTable table = createTable(30, SPREAD_SOFR_IORB, values);

        SpikeAnalysis analysis = detector.analyze(table, SPREAD_SOFR_IORB).orElseThrow();

        assertThat(analysis.isSpike()).isTrue();
        assertThat(analysis.getTriggeredRules()).containsExactly("ABSOLUTE");
        assertThat(analysis.getSeverity()).isEqualTo(SpikeSeverity.NORMAL);
        // 8 April sessions then 22 May sessions, every one above 10 bps
        assertThat(analysis.getQtdSpikeCount()).isEqualTo(30);
        assertThat(analysis.getMtdSpikeCount()).isEqualTo(22);
    }

    @Test
    void quarterToDateCount_followsConfiguredQuarterStartMonth() {
        double[] values = new double[30];
        for (int i = 0; i < 30; i++) values[i] = i % 2 == 0 ? 11.2 : 11.0;
        AlignedTable table = createTable(30, SPREAD_SOFR_IORB, values);
        SpikeDetector mayQuarters = new SpikeDetector(SpikeSettings.defaults(), 2);

        SpikeAnalysis analysis = mayQuarters.analyze(table, SPREAD_SOFR_IORB).orElseThrow();

        // quarter opens 1 May, so the April sessions fall outside it
        assertThat(analysis.getQtdSpikeCount()).isEqualTo(22);
        assertThat(analysis.getMtdSpikeCount()).isEqualTo(22);
    }

    @Test
    void percentileRule_onlyWithThreeMonthsOfHistory() {
        double[] values = new double[70];
        for (int i = 0; i < 69; i++) values[i] = -5 + (i % 10) * 0.5;
        values[69] = 0.0;
        AlignedTable longTable = createTable(70, SPREAD_SOFR_IORB, values);

        double[] shortValues = new double[30];
        System.arraycopy(values, 40, shortValues, 0, 30);
        AlignedTable shortTable = createTable(30, SPREAD_SOFR_IORB, shortValues);

        SpikeAnalysis longAnalysis = detector.analyze(longTable, SPREAD_SOFR_IORB).orElseThrow();
        Optional<SpikeAnalysis> shortAnalysis = detector.analyze(shortTable, SPREAD_SOFR_IORB);

        assertThat(longAnalysis.getTriggeredRules()).containsExactly("PERCENTILE");
        assertThat(shortAnalysis).isPresent();
        assertThat(shortAnalysis.get().getTriggeredRules()).doesNotContain("PERCENTILE");
    }

    @Test
    void severityBands() {
        assertThat(SpikeSeverity.fromDeviation(1.5, 1.0, 1.0)).isEqualTo(SpikeSeverity.NORMAL);
        assertThat(SpikeSeverity.fromDeviation(2.5, 1.0, 1.0)).isEqualTo(SpikeSeverity.ELEVATED);
        assertThat(SpikeSeverity.fromDeviation(3.5, 1.0, 1.0)).isEqualTo(SpikeSeverity.WARNING);
        assertThat(SpikeSeverity.fromDeviation(4.5, 1.0, 1.0)).isEqualTo(SpikeSeverity.CRITICAL);
        assertThat(SpikeSeverity.fromDeviation(4.5, Double.NaN, 1.0)).isEqualTo(SpikeSeverity.NORMAL);
    }
}
