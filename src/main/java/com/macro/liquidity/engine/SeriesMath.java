package com.macro.liquidity.engine;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Gap-aware numeric helpers over {@code double[]} columns where {@code NaN} marks a
 * missing observation. Every method returns a new array and leaves its input untouched.
 */
public final class SeriesMath {

    private SeriesMath() {}

    public static double[] missing(int length) {
        double[] out = new double[length];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    /** {@code v[i] - v[i - lag]}; missing when either side is missing. */
    public static double[] diff(double[] values, int lag) {
        double[] out = missing(values.length);
        for (int i = lag; i < values.length; i++) {
            out[i] = values[i] - values[i - lag];
        }
        return out;
    }

    /** {@code v[i - lag]}. */
    public static double[] shift(double[] values, int lag) {
        double[] out = missing(values.length);
        for (int i = lag; i < values.length; i++) {
            out[i] = values[i - lag];
        }
        return out;
    }

    public static double[] negate(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = -values[i];
        }
        return out;
    }

    public static double[] scale(double[] values, double factor) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] * factor;
        }
        return out;
    }

    /** Carries the last valid value forward without limit. Leading gaps stay missing. */
    public static double[] forwardFill(double[] values) {
        double[] out = Arrays.copyOf(values, values.length);
        double last = Double.NaN;
        for (int i = 0; i < out.length; i++) {
            if (Double.isNaN(out[i])) {
                out[i] = last;
            } else {
                last = out[i];
            }
        }
        return out;
    }

    public static double[] rollingMean(double[] values, int window, int minPeriods) {
        double[] out = missing(values.length);
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - window + 1);
            double sum = 0;
            int count = 0;
            for (int j = from; j <= i; j++) {
                if (!Double.isNaN(values[j])) {
                    sum += values[j];
                    count++;
                }
            }
            if (count >= minPeriods && count > 0) {
                out[i] = sum / count;
            }
        }
        return out;
    }

    public static double[] rollingSum(double[] values, int window, int minPeriods) {
        double[] out = missing(values.length);
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - window + 1);
            double sum = 0;
            int count = 0;
            for (int j = from; j <= i; j++) {
                if (!Double.isNaN(values[j])) {
                    sum += values[j];
                    count++;
                }
            }
            if (count >= minPeriods && count > 0) {
                out[i] = sum;
            }
        }
        return out;
    }

    /** Sample standard deviation over a trailing window; needs at least two valid points. */
    public static double[] rollingStd(double[] values, int window, int minPeriods) {
        double[] out = missing(values.length);
        for (int i = 0; i < values.length; i++) {
            double[] slice = validSlice(values, Math.max(0, i - window + 1), i + 1);
            if (slice.length >= Math.max(2, minPeriods)) {
                out[i] = sampleStd(slice);
            }
        }
        return out;
    }

    /** Trailing-window quantile with linear interpolation between order statistics. */
    public static double[] rollingQuantile(double[] values, int window, int minPeriods, double q) {
        double[] out = missing(values.length);
        for (int i = 0; i < values.length; i++) {
            double[] slice = validSlice(values, Math.max(0, i - window + 1), i + 1);
            if (slice.length >= Math.max(1, minPeriods)) {
                out[i] = quantile(slice, q);
            }
        }
        return out;
    }

    /** Valid values in {@code [from, to)}, in order. */
    public static double[] validSlice(double[] values, int from, int to) {
        return Arrays.stream(values, Math.max(0, from), Math.min(to, values.length))
                .filter(v -> !Double.isNaN(v))
                .toArray();
    }

    public static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return values.length == 0 ? Double.NaN : sum / values.length;
    }

    public static double sampleStd(double[] values) {
        if (values.length < 2) return Double.NaN;
        double mean = mean(values);
        double ss = 0;
        for (double v : values) {
            ss += (v - mean) * (v - mean);
        }
        return Math.sqrt(ss / (values.length - 1));
    }

    public static double quantile(double[] values, double q) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (pos - lower);
    }

    /**
     * Whole-sample z-score. A column with zero or undefined variance becomes zeros on its
     * valid positions; missing positions stay missing.
     */
    public static double[] zScore(double[] values) {
        double[] valid = validSlice(values, 0, values.length);
        double mean = mean(valid);
        double std = sampleStd(valid);
        boolean degenerate = Double.isNaN(std) || std == 0.0;
        double[] out = missing(values.length);
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                out[i] = degenerate ? 0.0 : (values[i] - mean) / std;
            }
        }
        return out;
    }

    /** Pearson correlation over pairwise-complete observations; empty when undefined. */
    public static OptionalDouble pearson(double[] x, double[] y) {
        int n = 0;
        double sx = 0;
        double sy = 0;
        for (int i = 0; i < x.length; i++) {
            if (!Double.isNaN(x[i]) && !Double.isNaN(y[i])) {
                sx += x[i];
                sy += y[i];
                n++;
            }
        }
        if (n < 2) return OptionalDouble.empty();
        double mx = sx / n;
        double my = sy / n;
        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (int i = 0; i < x.length; i++) {
            if (!Double.isNaN(x[i]) && !Double.isNaN(y[i])) {
                sxy += (x[i] - mx) * (y[i] - my);
                sxx += (x[i] - mx) * (x[i] - mx);
                syy += (y[i] - my) * (y[i] - my);
            }
        }
        if (sxx == 0 || syy == 0) return OptionalDouble.empty();
        return OptionalDouble.of(sxy / Math.sqrt(sxx * syy));
    }

    /**
     * Ordinary least squares of {@code y} on {@code x = 0..n-1}, computed on centered
     * values so a constant series yields a slope of exactly zero.
     */
    public static LinearFit fitLine(double[] y) {
        int n = y.length;
        if (n < 2) {
            throw new IllegalArgumentException("At least two points are required for a linear fit, got " + n);
        }
        double meanX = (n - 1) / 2.0;
        double meanY = mean(y);
        double sxy = 0;
        double sxx = 0;
        for (int i = 0; i < n; i++) {
            sxy += (i - meanX) * (y[i] - meanY);
            sxx += (i - meanX) * (i - meanX);
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;

        double ssRes = 0;
        double ssTot = 0;
        for (int i = 0; i < n; i++) {
            double predicted = slope * i + intercept;
            ssRes += (y[i] - predicted) * (y[i] - predicted);
            ssTot += (y[i] - meanY) * (y[i] - meanY);
        }
        // Rounding in the mean leaves a residue on constant input; treat it as no variance
        boolean noVariance = ssTot <= 1e-12 * n * Math.max(1.0, meanY * meanY);
        double rSquared = noVariance ? 0.0 : 1.0 - ssRes / ssTot;
        return new LinearFit(slope, intercept, rSquared);
    }

    public record LinearFit(double slope, double intercept, double rSquared) {

        public double valueAt(double x) {
            return slope * x + intercept;
        }
    }
}
