package com.macro.liquidity.engine;

import com.macro.liquidity.config.StressSettings;
import com.macro.liquidity.engine.stress.EffrSpreadStressCalculator;
import com.macro.liquidity.engine.stress.RepoUsageStressCalculator;
import com.macro.liquidity.engine.stress.RrpUsageStressCalculator;
import com.macro.liquidity.engine.stress.SofrSpreadStressCalculator;
import com.macro.liquidity.engine.stress.StressComponentCalculator;
import com.macro.liquidity.engine.stress.VolatilityStressCalculator;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.StressComponent;
import com.macro.liquidity.model.StressIndexResult;
import com.macro.liquidity.model.StressLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Weighted 0-100 money-market stress index. Every component is validated and clamped
 * before weighting, and a missing component counts as 0, so the index is always defined.
 */
public class StressIndexEngine {

    private static final Logger log = LoggerFactory.getLogger(StressIndexEngine.class);

    private final StressSettings settings;
    private final List<StressComponentCalculator> calculators;

    public StressIndexEngine(StressSettings settings) {
        this(settings, List.of(
                new SofrSpreadStressCalculator(),
                new EffrSpreadStressCalculator(),
                new VolatilityStressCalculator(),
                new RrpUsageStressCalculator(),
                new RepoUsageStressCalculator()));
    }

    public StressIndexEngine(StressSettings settings, List<StressComponentCalculator> calculators) {
        this.settings = settings;
        this.calculators = List.copyOf(calculators);
    }

    public StressIndexResult score(AlignedTable table) {
        List<StressComponent> components = new ArrayList<>();
        double total = 0.0;

        for (StressComponentCalculator calculator : calculators) {
            OptionalDouble raw = table.isEmpty() ? OptionalDouble.empty() : calculator.score(table, settings);
            double value = raw.isPresent() ? validate(raw.getAsDouble()) : 0.0;
            double weight = settings.weightOf(calculator.getName());
            components.add(StressComponent.builder()
                    .name(calculator.getName())
                    .value(value)
                    .weight(weight)
                    .available(raw.isPresent())
                    .build());
            total += value * weight;
        }

        double score = Math.max(0.0, Math.min(100.0, total));
        StressLevel level = StressLevel.fromScore(score,
                settings.getModerateAt(), settings.getElevatedAt(), settings.getHighAt());
        log.debug("Stress index {} ({}) from {}", score, level, components);

        return StressIndexResult.builder()
                .asOf(table.lastDate().orElse(null))
                .score(score)
                .level(level)
                .components(components)
                .build();
    }

    /** Non-finite scores become 0; everything else is clamped to [0, 100]. */
    private static double validate(double value) {
        if (!Double.isFinite(value)) return 0.0;
        return Math.max(0.0, Math.min(100.0, value));
    }
}
