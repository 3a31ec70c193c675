package com.macro.liquidity.engine.regime;

import com.macro.liquidity.config.RegimeSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.MetricNames;
import com.macro.liquidity.model.RegimeSignal;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Reverse-repo balance over the lookback. Cash leaving the facility returns liquidity to
 * the system (EASING); cash parked in it drains liquidity (TIGHTENING). Small moves abstain.
 */
public class ReserveDrainTrendDetector implements RegimeSignalDetector {

    @Override
    public String getName() {
        return "reserve-drain-trend";
    }

    @Override
    public Optional<RegimeSignal> detect(AlignedTable table, int from, RegimeSettings settings) {
        OptionalDouble change = WindowTrend.change(table, MetricNames.RRP_BALANCE, from);
        if (change.isEmpty()) return Optional.empty();
        double threshold = settings.getReserveDrainThreshold();
        if (change.getAsDouble() < -threshold) return Optional.of(RegimeSignal.EASING);
        if (change.getAsDouble() > threshold) return Optional.of(RegimeSignal.TIGHTENING);
        return Optional.empty();
    }
}
