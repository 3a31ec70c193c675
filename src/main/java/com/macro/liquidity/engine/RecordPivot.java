package com.macro.liquidity.engine;

import com.macro.liquidity.model.LongRecord;
import com.macro.liquidity.model.RawSeries;
import com.macro.liquidity.model.SeriesFrequency;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-to-wide reshape: groups records by key, then pivots each group onto its dates.
 * When several records share a (date, key) pair the first one in input order wins;
 * later duplicates are ignored rather than summed or averaged.
 */
public final class RecordPivot {

    private RecordPivot() {}

    public static Map<String, RawSeries> pivot(List<LongRecord> records, SeriesFrequency frequency) {
        Map<String, Map<LocalDate, Double>> grouped = new LinkedHashMap<>();
        for (LongRecord record : records) {
            if (record == null || record.getKey() == null || record.getDate() == null) {
                continue;
            }
            Map<LocalDate, Double> byDate = grouped.computeIfAbsent(record.getKey(), k -> new LinkedHashMap<>());
            if (!byDate.containsKey(record.getDate())) {
                byDate.put(record.getDate(), record.getValue());
            }
        }
        Map<String, RawSeries> series = new LinkedHashMap<>();
        grouped.forEach((key, values) -> series.put(key, RawSeries.of(key, frequency, values)));
        return series;
    }
}
