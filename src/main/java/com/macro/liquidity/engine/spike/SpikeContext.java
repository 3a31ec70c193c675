package com.macro.liquidity.engine.spike;

import com.macro.liquidity.config.SpikeSettings;
import com.macro.liquidity.engine.SeriesMath;

/**
 * Rolling statistics over the gap-free observations of one spread series, shared by
 * all spike rules. The percentile band is only computed once the series is long enough.
 */
public class SpikeContext {

    private final double[] values;
    private final double[] mean;
    private final double[] std;
    private final double[] upperPercentile;
    private final SpikeSettings settings;

    public SpikeContext(double[] values, SpikeSettings settings) {
        this.values = values;
        this.settings = settings;
        this.mean = SeriesMath.rollingMean(values, settings.getWindow(), settings.getMinPeriods());
        this.std = SeriesMath.rollingStd(values, settings.getWindow(), settings.getMinPeriods());
        this.upperPercentile = values.length >= settings.getPercentileWindow()
                ? SeriesMath.rollingQuantile(values, settings.getPercentileWindow(),
                        settings.getPercentileMinPeriods(), settings.getPercentile())
                : null;
    }

    public int size() {
        return values.length;
    }

    public double value(int i) {
        return values[i];
    }

    public double mean(int i) {
        return mean[i];
    }

    public double std(int i) {
        return std[i];
    }

    /** Rolling upper percentile, or {@code NaN} when the series is too short for the percentile rule. */
    public double upperPercentile(int i) {
        return upperPercentile == null ? Double.NaN : upperPercentile[i];
    }

    public double thresholdUpper(int i) {
        return mean[i] + settings.getThresholdStd() * std[i];
    }

    public SpikeSettings getSettings() {
        return settings;
    }
}
