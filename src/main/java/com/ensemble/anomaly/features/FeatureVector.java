package com.ensemble.anomaly.features;

import com.ensemble.anomaly.domain.DataRecord;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Projection of a record onto (amount, fraud_score, balance), in that order. Missing components are NaN
 * and are skipped pairwise by distance computations.
 */
public final class FeatureVector {

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector of(DataRecord record) {
        return new FeatureVector(new double[]{
                orNaN(RecordFeatures.amount(record)),
                orNaN(RecordFeatures.fraudScore(record)),
                orNaN(RecordFeatures.balance(record))});
    }

    private static double orNaN(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : Double.NaN;
    }

    public static FeatureVector[] ofAll(List<DataRecord> records) {
        FeatureVector[] vectors = new FeatureVector[records.size()];
        for (int i = 0; i < vectors.length; i++) {
            vectors[i] = of(records.get(i));
        }
        return vectors;
    }

    public static FeatureVector of(double... values) {
        return new FeatureVector(values.clone());
    }

    public int dimension() {
        return values.length;
    }

    /** Component value, NaN when missing. */
    public double get(int feature) {
        return values[feature];
    }

    public boolean isPresent(int feature) {
        return !Double.isNaN(values[feature]);
    }
}
