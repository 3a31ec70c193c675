package com.macro.liquidity.engine.stress;

import com.macro.liquidity.config.StressSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.MetricNames;

import java.util.OptionalDouble;

import static com.macro.liquidity.engine.stress.StressComponentCalculator.clamp;

public class RepoUsageStressCalculator implements StressComponentCalculator {

    @Override
    public String getName() {
        return StressSettings.REPO_USAGE;
    }

    @Override
    public OptionalDouble score(AlignedTable table, StressSettings settings) {
        OptionalDouble usage = StressComponentCalculator.latest(table, MetricNames.REPO_OPS_BALANCE);
        if (usage.isEmpty()) return OptionalDouble.empty();
        double cap = settings.getRepoUsageCap();
        return OptionalDouble.of(clamp(usage.getAsDouble(), 0.0, cap) / cap * 100.0);
    }
}
