package com.macro.liquidity.engine;

import com.macro.liquidity.config.CompositeSettings;
import com.macro.liquidity.config.CompositeTerm;
import com.macro.liquidity.config.SubIndexDefinition;
import com.macro.liquidity.model.AlignedTable;
import com.macro.liquidity.model.Column;
import com.macro.liquidity.model.CompositeIndexRecord;
import com.macro.liquidity.model.LiquidityRegimeBand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the composite liquidity index from weighted sub-indices.
 *
 * <p>Each term is transformed so that positive means liquidity added, then z-scored over
 * the whole sample of that column alone. A missing observation contributes 0 on its date.
 * A sub-index with no available term contributes 0 at its full weight; the remaining
 * weights are not rescaled, which keeps the composite comparable across runs with the
 * same sources.
 */
public class CompositeIndexAggregator {

    private static final Logger log = LoggerFactory.getLogger(CompositeIndexAggregator.class);

    private final CompositeSettings settings;

    public CompositeIndexAggregator(CompositeSettings settings) {
        this.settings = settings;
    }

    public List<CompositeIndexRecord> aggregate(AlignedTable table) {
        int n = table.size();
        Map<String, double[]> subIndices = new LinkedHashMap<>();
        double[] composite = new double[n];

        for (SubIndexDefinition definition : settings.getSubIndices()) {
            Optional<double[]> values = subIndex(table, definition);
            if (values.isEmpty()) {
                log.warn("Sub-index {} has no available inputs; contributing 0 at weight {}",
                        definition.getName(), definition.getWeight());
                continue;
            }
            subIndices.put(definition.getName(), values.get());
            for (int i = 0; i < n; i++) {
                composite[i] += definition.getWeight() * values.get()[i];
            }
        }

        double[] fast = SeriesMath.rollingMean(composite, settings.getFastWindow(), settings.getFastWindow());
        double[] slow = SeriesMath.rollingMean(composite, settings.getSlowWindow(), settings.getSlowWindow());

        List<CompositeIndexRecord> records = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (Map.Entry<String, double[]> entry : subIndices.entrySet()) {
                row.put(entry.getKey(), entry.getValue()[i]);
            }
            records.add(CompositeIndexRecord.builder()
                    .date(table.dateAt(i))
                    .subIndices(row)
                    .composite(composite[i])
                    .compositeFast(Double.isNaN(fast[i]) ? null : fast[i])
                    .compositeSlow(Double.isNaN(slow[i]) ? null : slow[i])
                    .band(LiquidityRegimeBand.fromComposite(composite[i], settings.getBandCutPoints()))
                    .build());
        }
        return records;
    }

    /**
     * Weighted sum of z-scored terms, or empty when none of the terms is available.
     */
    public Optional<double[]> subIndex(AlignedTable table, SubIndexDefinition definition) {
        double[] out = new double[table.size()];
        int used = 0;
        for (CompositeTerm term : definition.getTerms()) {
            Optional<double[]> transformed = table.column(term.getColumn())
                    .filter(Column::hasAnyValue)
                    .map(c -> transform(c.toArray(), term));
            if (transformed.isEmpty() || SeriesMath.validSlice(transformed.get(), 0, table.size()).length == 0) {
                continue;
            }
            double[] z = SeriesMath.zScore(transformed.get());
            for (int i = 0; i < out.length; i++) {
                if (!Double.isNaN(z[i])) {
                    out[i] += term.getWeight() * z[i];
                }
            }
            used++;
        }
        return used == 0 ? Optional.empty() : Optional.of(out);
    }

    private static double[] transform(double[] values, CompositeTerm term) {
        switch (term.getTransform()) {
            case NEGATED_LEVEL:
                return SeriesMath.negate(values);
            case CHANGE:
                return SeriesMath.diff(values, 1);
            case NEGATED_CHANGE:
                return SeriesMath.negate(SeriesMath.diff(values, 1));
            default:
                return values;
        }
    }
}
