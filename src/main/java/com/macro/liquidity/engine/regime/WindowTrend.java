package com.macro.liquidity.engine.regime;

import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.Column;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

final class WindowTrend {

    private WindowTrend() {}

    /** Last valid minus first valid value of {@code column} inside {@code [from, size)}. */
    static OptionalDouble change(AlignedTable table, String column, int from) {
        Optional<Column> values = table.column(column);
        if (values.isEmpty()) return OptionalDouble.empty();
        OptionalInt first = values.get().firstValidIndex(from, table.size());
        OptionalInt last = values.get().lastValidIndex(from, table.size());
        if (first.isEmpty() || first.getAsInt() == last.getAsInt()) return OptionalDouble.empty();
        return OptionalDouble.of(values.get().get(last.getAsInt()) - values.get().get(first.getAsInt()));
    }
}
