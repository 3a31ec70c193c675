package com.macro.liquidity.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Date-indexed table of numeric columns sharing one ascending, duplicate-free date axis.
 * Gaps are stored as {@code NaN}; rows are never dropped.
 */
public final class AlignedTable {

    private final List<LocalDate> dates;
    private final Map<String, double[]> columns = new LinkedHashMap<>();

    public AlignedTable(List<LocalDate> dates) {
        Objects.requireNonNull(dates, "dates");
        for (int i = 1; i < dates.size(); i++) {
            if (!dates.get(i).isAfter(dates.get(i - 1))) {
                throw new IllegalArgumentException("Date axis must be strictly ascending at index " + i
                        + ": " + dates.get(i - 1) + " -> " + dates.get(i));
            }
        }
        this.dates = Collections.unmodifiableList(new ArrayList<>(dates));
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    public int size() {
        return dates.size();
    }

    public boolean isEmpty() {
        return dates.isEmpty();
    }

    public Optional<LocalDate> lastDate() {
        return dates.isEmpty() ? Optional.empty() : Optional.of(dates.get(dates.size() - 1));
    }

    public LocalDate dateAt(int index) {
        return dates.get(index);
    }

    /** Adds or replaces a column. The array is copied. */
    public void putColumn(String name, double[] values) {
        Objects.requireNonNull(name, "name");
        if (values.length != dates.size()) {
            throw new IllegalArgumentException("Column " + name + " has " + values.length
                    + " values but the table has " + dates.size() + " dates");
        }
        columns.put(name, Arrays.copyOf(values, values.length));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Optional<Column> column(String name) {
        double[] values = columns.get(name);
        return values == null ? Optional.empty() : Optional.of(new Column(name, values));
    }

    public Set<String> columnNames() {
        return Collections.unmodifiableSet(columns.keySet());
    }

    public AlignedTable copy() {
        AlignedTable copy = new AlignedTable(dates);
        columns.forEach(copy::putColumn);
        return copy;
    }

    /** Column values on one row, missing values omitted. */
    public Map<String, Double> row(int index) {
        Map<String, Double> row = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            if (!Double.isNaN(values[index])) row.put(name, values[index]);
        });
        return row;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlignedTable)) return false;
        AlignedTable other = (AlignedTable) o;
        if (!dates.equals(other.dates) || !columns.keySet().equals(other.columns.keySet())) return false;
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            if (!Arrays.equals(entry.getValue(), other.columns.get(entry.getKey()))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = dates.hashCode();
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            result = 31 * result + entry.getKey().hashCode();
            result = 31 * result + Arrays.hashCode(entry.getValue());
        }
        return result;
    }

    @Override
    public String toString() {
        return "AlignedTable{rows=" + dates.size() + ", columns=" + columns.keySet() + "}";
    }
}
