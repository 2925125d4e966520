package com.forensicalpha.common.normalization;

import java.util.ArrayList;
import java.util.List;

/**
 * Expanding-window z-score with no look-ahead.
 *
 * <p>For each position {@code i} the window is the non-null values at positions
 * {@code 0..i}. The output at {@code i} is:
 * <pre>
 *   source[i] == null                         → null
 *   window size &lt; 2  or  stddev(window) == 0 → 0.0
 *   otherwise                                 → (source[i] − mean(window)) / stddev(window)
 * </pre>
 * {@code stddev} is the <b>sample</b> standard deviation (divisor N − 1). A window whose
 * values are all identical is treated as zero variance without relying on floating-point
 * cancellation.
 *
 * <p>The 0.0 for a degenerate window means "no information yet", not "exactly average";
 * it is kept as-is because historical outputs depend on it.
 *
 * <p>Each window is rescaled by the power of two nearest its largest magnitude before the
 * mean and variance are accumulated. The z-score is invariant under that rescaling, and a
 * power-of-two factor is exact, so ordinary inputs give the same bits as an unscaled
 * computation while values near {@link Double#MAX_VALUE} no longer overflow the sums.
 *
 * <p>The value at {@code i} depends only on positions {@code ≤ i}. Sums are accumulated in
 * index order, so identical input always yields bit-identical output.
 */
public final class ExpandingZScoreNormalizer {

    static final int MIN_OBSERVATIONS = 2;

    private ExpandingZScoreNormalizer() {}

    /**
     * @param series values in year order; entries may be null, the list itself may not
     * @return same-length list of normalized values, null exactly where {@code series} is null
     */
    public static List<Double> normalize(List<Double> series) {
        List<Double> result = new ArrayList<>(series.size());
        List<Double> window = new ArrayList<>(series.size());

        for (Double value : series) {
            if (value == null) {
                result.add(null);
                continue;
            }
            window.add(value);
            result.add(zScore(value, window));
        }
        return result;
    }

    /** Sample standard deviation of {@code values}; 0.0 for fewer than two values or a constant window. */
    public static double sampleStdDev(List<Double> values) {
        if (values.size() < MIN_OBSERVATIONS || isConstant(values)) {
            return 0.0;
        }
        int exponent = scaleExponent(values);
        return Math.scalb(scaledStdDev(scaled(values, exponent)), exponent);
    }

    static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static double zScore(double current, List<Double> window) {
        if (window.size() < MIN_OBSERVATIONS || isConstant(window)) {
            return 0.0;
        }
        int exponent = scaleExponent(window);
        List<Double> scaled = scaled(window, exponent);
        double std = scaledStdDev(scaled);
        if (std == 0.0) {
            return 0.0;
        }
        return (Math.scalb(current, -exponent) - mean(scaled)) / std;
    }

    /** Caller guarantees at least two values whose magnitudes are at most 2. */
    private static double scaledStdDev(List<Double> scaled) {
        double mean = mean(scaled);
        double sumSq = 0.0;
        for (double v : scaled) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (scaled.size() - 1));
    }

    /** Binary exponent of the largest magnitude in {@code values}. */
    private static int scaleExponent(List<Double> values) {
        double maxAbs = 0.0;
        for (double v : values) {
            maxAbs = Math.max(maxAbs, Math.abs(v));
        }
        return maxAbs == 0.0 ? 0 : Math.getExponent(maxAbs);
    }

    private static List<Double> scaled(List<Double> values, int exponent) {
        List<Double> out = new ArrayList<>(values.size());
        for (double v : values) {
            out.add(Math.scalb(v, -exponent));
        }
        return out;
    }

    private static boolean isConstant(List<Double> values) {
        double first = values.get(0);
        for (double v : values) {
            if (Double.compare(v, first) != 0) return false;
        }
        return true;
    }
}
