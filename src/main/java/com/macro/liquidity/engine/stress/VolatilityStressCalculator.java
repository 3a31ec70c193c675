package com.macro.liquidity.engine.stress;

import com.macro.liquidity.config.StressSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.MetricNames;

import java.util.OptionalDouble;

import static com.macro.liquidity.engine.stress.StressComponentCalculator.clamp;

public class VolatilityStressCalculator implements StressComponentCalculator {

    @Override
    public String getName() {
        return StressSettings.VOLATILITY;
    }

    @Override
    public OptionalDouble score(AlignedTable table, StressSettings settings) {
        OptionalDouble vol = StressComponentCalculator.latest(table, MetricNames.SOFR_VOL_5D);
        if (vol.isEmpty()) return OptionalDouble.empty();
        double cap = settings.getVolatilityCap();
        return OptionalDouble.of(clamp(vol.getAsDouble(), 0.0, cap) / cap * 100.0);
    }
}
