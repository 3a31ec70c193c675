package com.macro.liquidity.engine;

import com.macro.liquidity.config.MonitoringSettings;
import com.macro.liquidity.model.AlertSeverity;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.LiquidityAlert;
import com.macro.liquidity.model.MetricNames;
import com.macro.liquidity.model.PeriodChange;
import com.macro.liquidity.model.RollingWindowSummary;
import com.macro.liquidity.model.SpikeAnalysis;
import com.macro.liquidity.model.SpikeSeverity;
import com.macro.liquidity.model.StressIndexResult;
import com.macro.liquidity.model.TemporalSummary;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Turns the results of one run into reader-facing alerts.
 */
public class AlertEvaluator {

    private final MonitoringSettings settings;

    public AlertEvaluator(MonitoringSettings settings) {
        this.settings = settings;
    }

    /**
     * @param assets       temporal summary of total assets, may be null
     * @param netLiquidity temporal summary of net liquidity, may be null
     * @param spikes       spread spike analysis, may be null
     */
    public List<LiquidityAlert> evaluate(AlignedTable table, StressIndexResult stress, SpikeAnalysis spikes,
                                         TemporalSummary assets, TemporalSummary netLiquidity) {
        List<LiquidityAlert> alerts = new ArrayList<>();
        if (table.isEmpty()) {
            return alerts;
        }

        if (stress != null) {
            if (stress.getScore() >= settings.getStressCriticalAt()) {
                alerts.add(alert(AlertSeverity.CRITICAL, "STRESS",
                        String.format("Stress index at %.0f/100 (%s)", stress.getScore(), stress.getLevel())));
            } else if (stress.getScore() >= settings.getStressWarningAt()) {
                alerts.add(alert(AlertSeverity.WARNING, "STRESS",
                        String.format("Stress index at %.0f/100 (%s)", stress.getScore(), stress.getLevel())));
            }
        }

        if (spikes != null && spikes.isSpike()
                && (spikes.getSeverity() == SpikeSeverity.WARNING || spikes.getSeverity() == SpikeSeverity.CRITICAL)) {
            alerts.add(alert(AlertSeverity.valueOf(spikes.getSeverity().name()), "SPREAD_SPIKE",
                    String.format("%s spike: %.2f bps (%s)",
                            spikes.getColumn(), spikes.getCurrentValue(), spikes.getSeverity())));
        }

        PeriodChange qtd = assets != null ? assets.getQuarterToDate() : null;
        if (qtd != null && qtd.getAnnualizedPace() != null
                && qtd.getAnnualizedPace() < settings.getQtPaceAnnualizedFloor()) {
            alerts.add(alert(AlertSeverity.WARNING, "QT_PACE",
                    String.format("Aggressive balance-sheet run-off: %,.0fM/year annualized", qtd.getAnnualizedPace())));
        }

        RollingWindowSummary rolling = netLiquidity != null ? netLiquidity.getRolling3m() : null;
        if (rolling != null) {
            double percentile = rolling.getPercentileRank();
            if (percentile < settings.getNetLiquidityLowPercentile()) {
                alerts.add(alert(AlertSeverity.WARNING, "LIQUIDITY",
                        String.format("Net liquidity at %.0fth percentile of 3M range (very low)", percentile)));
            } else if (percentile > settings.getNetLiquidityHighPercentile()) {
                alerts.add(alert(AlertSeverity.INFO, "LIQUIDITY",
                        String.format("Net liquidity at %.0fth percentile of 3M range (very high)", percentile)));
            }
        }

        OptionalDouble swapLines = table.column(MetricNames.SWAP_LINES)
                .map(c -> c.latest())
                .orElse(OptionalDouble.empty());
        if (swapLines.isPresent() && swapLines.getAsDouble() > settings.getSwapLinesThreshold()) {
            alerts.add(alert(AlertSeverity.CRITICAL, "SWAP_LINES",
                    String.format("Central bank swap lines active: %,.0fM", swapLines.getAsDouble())));
        }
        return alerts;
    }

    private static LiquidityAlert alert(AlertSeverity severity, String type, String message) {
        return LiquidityAlert.builder().severity(severity).type(type).message(message).build();
    }
}
