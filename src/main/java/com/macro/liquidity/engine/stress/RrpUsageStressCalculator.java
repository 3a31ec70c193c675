package com.macro.liquidity.engine.stress;

import com.macro.liquidity.config.StressSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.MetricNames;

import java.util.OptionalDouble;

import static com.macro.liquidity.engine.stress.StressComponentCalculator.clamp;

/**
 * Reverse-repo balance against its 20-session average, inverted: cash leaving the facility
 * faster than usual scores higher. A balance at or above its average scores 0.
 */
public class RrpUsageStressCalculator implements StressComponentCalculator {

    @Override
    public String getName() {
        return StressSettings.RRP_USAGE;
    }

    @Override
    public OptionalDouble score(AlignedTable table, StressSettings settings) {
        OptionalDouble rrp = StressComponentCalculator.latest(table, MetricNames.RRP_BALANCE);
        OptionalDouble average = StressComponentCalculator.latest(table, MetricNames.MA20_RRP);
        if (rrp.isEmpty() || average.isEmpty()) return OptionalDouble.empty();
        if (average.getAsDouble() <= 0) {
            return OptionalDouble.of(0.0);
        }
        double ratio = rrp.getAsDouble() / average.getAsDouble();
        return OptionalDouble.of(clamp((1.0 - ratio) * 100.0, 0.0, 100.0));
    }
}
