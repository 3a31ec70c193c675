package com.macro.liquidity.engine.stress;

import com.macro.liquidity.config.StressSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.MetricNames;

import java.util.OptionalDouble;

import static com.macro.liquidity.engine.stress.StressComponentCalculator.clamp;

/**
 * EFFR over IORB. EFFR normally prints at or below IORB, so only the positive side scores.
 */
public class EffrSpreadStressCalculator implements StressComponentCalculator {

    @Override
    public String getName() {
        return StressSettings.EFFR_SPREAD;
    }

    @Override
    public OptionalDouble score(AlignedTable table, StressSettings settings) {
        OptionalDouble spread = StressComponentCalculator.latest(table, MetricNames.SPREAD_EFFR_IORB);
        if (spread.isEmpty()) return OptionalDouble.empty();
        double clamped = clamp(spread.getAsDouble(), settings.getEffrSpreadFloorBps(), settings.getEffrSpreadCapBps());
        if (clamped <= 0) {
            return OptionalDouble.of(0.0);
        }
        return OptionalDouble.of(clamped / settings.getEffrSpreadCapBps() * 100.0);
    }
}
