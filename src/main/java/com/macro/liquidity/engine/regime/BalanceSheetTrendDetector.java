package com.macro.liquidity.engine.regime;

import com.macro.liquidity.config.RegimeSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.MetricNames;
import com.macro.liquidity.model.RegimeSignal;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Total assets over the lookback: a large fall votes QT, a large rise QE, otherwise NEUTRAL.
 */
public class BalanceSheetTrendDetector implements RegimeSignalDetector {

    @Override
    public String getName() {
        return "balance-sheet-trend";
    }

    @Override
    public Optional<RegimeSignal> detect(AlignedTable table, int from, RegimeSettings settings) {
        OptionalDouble change = WindowTrend.change(table, MetricNames.FED_TOTAL_ASSETS, from);
        if (change.isEmpty()) return Optional.empty();
        double threshold = settings.getAssetTrendThreshold();
        if (change.getAsDouble() < -threshold) return Optional.of(RegimeSignal.QT);
        if (change.getAsDouble() > threshold) return Optional.of(RegimeSignal.QE);
        return Optional.of(RegimeSignal.NEUTRAL);
    }
}
