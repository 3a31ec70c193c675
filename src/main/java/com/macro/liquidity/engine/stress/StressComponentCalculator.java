package com.macro.liquidity.engine.stress;

import com.macro.liquidity.config.StressSettings;
import com.macro.liquidity.model.AlignedTable;

import java.util.OptionalDouble;

/**
 * Computes one stress sub-score from the last row of the table.
 */
public interface StressComponentCalculator {

    /**
     * Component name, also the key of its weight in {@link StressSettings#getWeights()}.
     */
    String getName();

    /**
     * @return the sub-score on a 0-100 scale, or empty when the inputs are missing
     */
    OptionalDouble score(AlignedTable table, StressSettings settings);

    static OptionalDouble latest(AlignedTable table, String column) {
        return table.column(column).map(c -> c.latest()).orElse(OptionalDouble.empty());
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
