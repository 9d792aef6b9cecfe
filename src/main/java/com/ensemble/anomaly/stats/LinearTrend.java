package com.ensemble.anomaly.stats;

import lombok.Value;

/**
 * y = slope * x + intercept.
 */
@Value
public class LinearTrend {

    double slope;
    double intercept;

    public double valueAt(double x) {
        return slope * x + intercept;
    }
}
