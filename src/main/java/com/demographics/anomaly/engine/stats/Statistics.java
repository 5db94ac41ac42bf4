package com.demographics.anomaly.engine.stats;

import java.util.Arrays;

/**
 * Descriptive statistics over plain arrays. NaN entries are treated as missing
 * by the rolling and robust helpers and propagate through the plain ones.
 */
public final class Statistics {

    // Scales a median absolute deviation to a normal-consistent standard deviation
    public static final double MAD_SCALE = 1.4826;

    private Statistics() {}

    public static double mean(double[] values) {
        if (values.length == 0) return Double.NaN;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Standard deviation with divisor n. */
    public static double populationStd(double[] values) {
        if (values.length == 0) return Double.NaN;
        return Math.sqrt(sumSquaredDeviations(values) / values.length);
    }

    /** Standard deviation with divisor n - 1; NaN below two values. */
    public static double sampleStd(double[] values) {
        if (values.length < 2) return Double.NaN;
        return Math.sqrt(sumSquaredDeviations(values) / (values.length - 1));
    }

    public static double median(double[] values) {
        if (values.length == 0) return Double.NaN;
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) return sorted[mid];
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /** Unscaled median absolute deviation around the median. */
    public static double medianAbsoluteDeviation(double[] values) {
        double med = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - med);
        }
        return median(deviations);
    }

    /**
     * Trailing rolling mean: position i covers values[i - window + 1 .. i].
     * NaN where the window holds fewer than minPeriods non-missing values.
     */
    public static double[] rollingMean(double[] values, int window, int minPeriods) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double[] w = present(values, Math.max(0, i - window + 1), i);
            out[i] = w.length >= minPeriods ? mean(w) : Double.NaN;
        }
        return out;
    }

    /** Trailing rolling sample standard deviation, same window rules as {@link #rollingMean}. */
    public static double[] rollingSampleStd(double[] values, int window, int minPeriods) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double[] w = present(values, Math.max(0, i - window + 1), i);
            out[i] = w.length >= Math.max(2, minPeriods) ? sampleStd(w) : Double.NaN;
        }
        return out;
    }

    /**
     * Centered rolling median. For an odd window the current point sits in the middle;
     * an even window leans one slot to the left.
     */
    public static double[] centeredRollingMedian(double[] values, int window, int minPeriods) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double[] w = centeredWindow(values, i, window);
            out[i] = w.length >= minPeriods ? median(w) : Double.NaN;
        }
        return out;
    }

    /** Centered rolling unscaled MAD. */
    public static double[] centeredRollingMad(double[] values, int window, int minPeriods) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double[] w = centeredWindow(values, i, window);
            out[i] = w.length >= minPeriods ? medianAbsoluteDeviation(w) : Double.NaN;
        }
        return out;
    }

    public static boolean isFinite(double v) {
        return !Double.isNaN(v) && !Double.isInfinite(v);
    }

    private static double[] centeredWindow(double[] values, int center, int window) {
        int right = (window - 1) / 2;
        int left = window - 1 - right;
        int from = Math.max(0, center - left);
        int to = Math.min(values.length - 1, center + right);
        return present(values, from, to);
    }

    private static double[] present(double[] values, int from, int toInclusive) {
        return Arrays.stream(values, from, toInclusive + 1)
                .filter(v -> !Double.isNaN(v))
                .toArray();
    }

    private static double sumSquaredDeviations(double[] values) {
        double m = mean(values);
        double ss = 0.0;
        for (double v : values) {
            double d = v - m;
            ss += d * d;
        }
        return ss;
    }
}
