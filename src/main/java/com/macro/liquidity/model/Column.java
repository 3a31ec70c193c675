package com.macro.liquidity.model;

import java.util.Arrays;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Read-only view of one table column. Missing observations are {@code NaN}.
 */
public final class Column {

    private final String name;
    private final double[] values;

    Column(String name, double[] values) {
        this.name = name;
        this.values = values;
    }

    public String getName() {
        return name;
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public boolean isValid(int index) {
        return !Double.isNaN(values[index]);
    }

    public double[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    public boolean hasAnyValue() {
        return firstValidIndex(0, values.length).isPresent();
    }

    public int validCount() {
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) count++;
        }
        return count;
    }

    /** First non-missing index in {@code [from, to)}. */
    public OptionalInt firstValidIndex(int from, int to) {
        for (int i = Math.max(0, from); i < Math.min(to, values.length); i++) {
            if (!Double.isNaN(values[i])) return OptionalInt.of(i);
        }
        return OptionalInt.empty();
    }

    /** Last non-missing index in {@code [from, to)}. */
    public OptionalInt lastValidIndex(int from, int to) {
        for (int i = Math.min(to, values.length) - 1; i >= Math.max(0, from); i--) {
            if (!Double.isNaN(values[i])) return OptionalInt.of(i);
        }
        return OptionalInt.empty();
    }

    /** Value on the last row of the table, empty when that row is missing. */
    public OptionalDouble latest() {
        if (values.length == 0 || Double.isNaN(values[values.length - 1])) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(values[values.length - 1]);
    }
}
