package com.macro.liquidity.engine;

import com.macro.liquidity.config.MonitoringSettings;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.Column;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static com.macro.liquidity.model.MetricNames.*;

/**
 * Pearson correlations between liquidity metrics over the trailing window. A pair is
 * omitted when a column is missing or either side has no variance.
 */
public class CorrelationCalculator {

    public static final List<Pair> DEFAULT_PAIRS = List.of(
            new Pair("net_liq_vs_tga", NET_LIQUIDITY, TGA_BALANCE),
            new Pair("rrp_vs_sofr_spread", RRP_BALANCE, SPREAD_SOFR_IORB),
            new Pair("assets_vs_inflation_exp", FED_TOTAL_ASSETS, BREAKEVEN_10Y),
            new Pair("net_liq_vs_spread", NET_LIQUIDITY, SPREAD_SOFR_IORB));

    private final MonitoringSettings settings;
    private final List<Pair> pairs;

    public CorrelationCalculator(MonitoringSettings settings) {
        this(settings, DEFAULT_PAIRS);
    }

    public CorrelationCalculator(MonitoringSettings settings, List<Pair> pairs) {
        this.settings = settings;
        this.pairs = List.copyOf(pairs);
    }

    public Map<String, Double> correlate(AlignedTable table) {
        Map<String, Double> result = new LinkedHashMap<>();
        if (table.size() < settings.getCorrelationMinRows()) {
            return result;
        }
        int from = Math.max(0, table.size() - settings.getCorrelationWindow());
        for (Pair pair : pairs) {
            Optional<Column> left = table.column(pair.left());
            Optional<Column> right = table.column(pair.right());
            if (left.isEmpty() || right.isEmpty()) continue;
            OptionalDouble r = SeriesMath.pearson(tail(left.get(), from), tail(right.get(), from));
            r.ifPresent(value -> result.put(pair.name(), value));
        }
        return result;
    }

    private static double[] tail(Column column, int from) {
        double[] all = column.toArray();
        double[] out = new double[all.length - from];
        System.arraycopy(all, from, out, 0, out.length);
        return out;
    }

    public record Pair(String name, String left, String right) {}
}
