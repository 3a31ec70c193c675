package com.macro.liquidity.engine;

import com.macro.liquidity.model.AlignedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies registered {@link MetricDerivation}s in order, appending their columns.
 * Later derivations see the columns produced by earlier ones.
 */
public class MetricsDeriver {

    private static final Logger log = LoggerFactory.getLogger(MetricsDeriver.class);

    private final List<MetricDerivation> derivations;

    public MetricsDeriver(List<MetricDerivation> derivations) {
        this.derivations = List.copyOf(derivations);
        for (MetricDerivation derivation : this.derivations) {
            log.info("Registered metric derivation: {} -> {}",
                    derivation.getName(), derivation.getClass().getSimpleName());
        }
    }

    public List<MetricDerivation> getDerivations() {
        return derivations;
    }

    /**
     * Derive every metric whose required inputs are available. The source table is left
     * untouched; the result is a copy with the derived columns appended.
     */
    public DerivationOutcome derive(AlignedTable source) {
        AlignedTable table = source.copy();
        List<String> skipped = new ArrayList<>();

        for (MetricDerivation derivation : derivations) {
            MetricInputs inputs = new MetricInputs(table);
            List<String> missing = derivation.getRequiredInputs().stream()
                    .filter(name -> !inputs.isPresent(name))
                    .toList();
            if (!missing.isEmpty()) {
                log.debug("Skipping derivation {}: missing {}", derivation.getName(), missing);
                skipped.add(derivation.getName());
                continue;
            }

            try {
                Map<String, double[]> columns = derivation.derive(inputs);
                columns.forEach(table::putColumn);
            } catch (RuntimeException e) {
                log.error("Error in derivation {}: {}", derivation.getName(), e.getMessage(), e);
                // One broken derivation must not block the rest of the table
                skipped.add(derivation.getName());
            }
        }

        return new DerivationOutcome(table, List.copyOf(skipped));
    }

    public record DerivationOutcome(AlignedTable table, List<String> skipped) {}
}
