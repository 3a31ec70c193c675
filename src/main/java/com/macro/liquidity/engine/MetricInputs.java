package com.macro.liquidity.engine;

import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.Column;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the table handed to a {@link MetricDerivation}. A column that
 * exists but holds no valid value is reported as absent.
 */
public class MetricInputs {

    private final AlignedTable table;

    public MetricInputs(AlignedTable table) {
        this.table = table;
    }

    public Optional<Column> get(String name) {
        return table.column(name).filter(Column::hasAnyValue);
    }

    public boolean isPresent(String name) {
        return get(name).isPresent();
    }

    public double[] require(String name) {
        return get(name)
                .orElseThrow(() -> new IllegalStateException("Required input " + name + " is not available"))
                .toArray();
    }

    public List<LocalDate> dates() {
        return table.getDates();
    }

    public int size() {
        return table.size();
    }
}
