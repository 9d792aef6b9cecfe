package com.ensemble.anomaly.stats;

import com.ensemble.anomaly.features.FeatureVector;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.OptionalDouble;

/**
 * Shared statistics and distance helpers used by all detectors.
 * Empty input gives NaN for mean/std; callers treat NaN and zero spread as "no signal".
 */
public final class NumericUtils {

    /** Spread at or below this is treated as zero variance. */
    public static final double ZERO_VARIANCE_EPSILON = 1e-12;

    private NumericUtils() {
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /** Mean of values[from, to); NaN when the range is empty. */
    public static double mean(double[] values, int from, int to) {
        if (to - from <= 0) return Double.NaN;
        return new Mean().evaluate(values, from, to - from);
    }

    public static double populationStd(double[] values) {
        return populationStd(values, 0, values.length);
    }

    /** Population standard deviation of values[from, to); NaN when the range is empty. */
    public static double populationStd(double[] values, int from, int to) {
        if (to - from <= 0) return Double.NaN;
        return new StandardDeviation(false).evaluate(values, from, to - from);
    }

    /**
     * Absolute z-score, or empty when the statistics carry no signal
     * (NaN mean or std, or std at or below {@link #ZERO_VARIANCE_EPSILON}).
     */
    public static OptionalDouble absZScore(double value, double mean, double std) {
        if (!hasSpread(mean, std) || !Double.isFinite(value)) return OptionalDouble.empty();
        return OptionalDouble.of(Math.abs((value - mean) / std));
    }

    public static boolean hasSpread(double mean, double std) {
        return Double.isFinite(mean) && Double.isFinite(std) && std > ZERO_VARIANCE_EPSILON;
    }

    /**
     * Euclidean distance over the components present in both vectors. Vectors sharing no
     * component are at distance 0.
     */
    public static double euclideanDistance(FeatureVector a, FeatureVector b) {
        int dims = Math.min(a.dimension(), b.dimension());
        double sum = 0.0;
        for (int i = 0; i < dims; i++) {
            if (a.isPresent(i) && b.isPresent(i)) {
                double diff = a.get(i) - b.get(i);
                sum += diff * diff;
            }
        }
        return Math.sqrt(sum);
    }

    /** Symmetric pairwise distance matrix. */
    public static double[][] distanceMatrix(FeatureVector[] vectors) {
        int n = vectors.length;
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = euclideanDistance(vectors[i], vectors[j]);
                distances[i][j] = d;
                distances[j][i] = d;
            }
        }
        return distances;
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }

    /** Ordinary least-squares fit of values against their position 0..n-1. */
    public static LinearTrend fitTrend(double[] values) {
        int n = values.length;
        if (n < 2) {
            return new LinearTrend(0.0, n == 1 ? values[0] : Double.NaN);
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, values[i]);
        }
        return new LinearTrend(regression.getSlope(), regression.getIntercept());
    }
}
