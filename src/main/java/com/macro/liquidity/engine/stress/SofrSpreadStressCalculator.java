package com.macro.liquidity.engine.stress;

import com.macro.liquidity.config.StressSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.MetricNames;

import java.util.OptionalDouble;

import static com.macro.liquidity.engine.stress.StressComponentCalculator.clamp;

/**
 * SOFR over IORB: 0 bps scores 0, the cap scores 100. Negative spreads clamp to 0.
 */
public class SofrSpreadStressCalculator implements StressComponentCalculator {

    @Override
    public String getName() {
        return StressSettings.SOFR_SPREAD;
    }

    @Override
    public OptionalDouble score(AlignedTable table, StressSettings settings) {
        OptionalDouble spread = StressComponentCalculator.latest(table, MetricNames.SPREAD_SOFR_IORB);
        if (spread.isEmpty()) return OptionalDouble.empty();
        double cap = settings.getSofrSpreadCapBps();
        double clamped = clamp(spread.getAsDouble(), 0.0, cap);
        return OptionalDouble.of(clamped / cap * 100.0);
    }
}
