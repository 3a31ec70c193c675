package com.macro.liquidity.engine;

import java.util.List;
import java.util.Map;

/**
 * Interface for all derived-metric rules. Each implementation declares the columns it
 * cannot work without and the ones it uses when present; the deriver only calls
 * {@link #derive} once every required input has at least one valid value.
 */
public interface MetricDerivation {

    /**
     * Short name used in logs and in the skipped-derivation report.
     */
    String getName();

    List<String> getRequiredInputs();

    default List<String> getOptionalInputs() {
        return List.of();
    }

    /**
     * Compute the output columns.
     *
     * @param inputs typed view of the table; required inputs are guaranteed present
     * @return new columns keyed by name, each as long as the table
     */
    Map<String, double[]> derive(MetricInputs inputs);
}
