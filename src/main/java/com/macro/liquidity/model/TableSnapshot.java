package com.macro.liquidity.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Column-oriented export of the aligned table; missing values are null")
public class TableSnapshot {

    private List<LocalDate> dates;

    private Map<String, List<Double>> columns;

    public static TableSnapshot from(AlignedTable table) {
        Map<String, List<Double>> columns = new LinkedHashMap<>();
        for (String name : table.columnNames()) {
            double[] values = table.column(name).orElseThrow().toArray();
            List<Double> list = new ArrayList<>(values.length);
            for (double v : values) {
                list.add(Double.isNaN(v) ? null : v);
            }
            columns.put(name, list);
        }
        return new TableSnapshot(table.getDates(), columns);
    }
}
