package com.ensemble.anomaly.engine;

import com.ensemble.anomaly.domain.Severity;

/**
 * Maps a normalized anomaly score to a severity band with fixed cut-offs.
 */
public final class SeverityClassifier {

    public static final double CRITICAL_THRESHOLD = 0.8;
    public static final double HIGH_THRESHOLD = 0.6;
    public static final double MEDIUM_THRESHOLD = 0.4;
    public static final double LOW_THRESHOLD = 0.2;

    private SeverityClassifier() {
    }

    /** NaN scores classify as minimal. */
    public static Severity classify(double score) {
        if (score >= CRITICAL_THRESHOLD) return Severity.CRITICAL;
        if (score >= HIGH_THRESHOLD) return Severity.HIGH;
        if (score >= MEDIUM_THRESHOLD) return Severity.MEDIUM;
        if (score >= LOW_THRESHOLD) return Severity.LOW;
        return Severity.MINIMAL;
    }

    /** 1 (critical) to 5 (minimal); null sorts last. */
    public static int priority(Severity severity) {
        return severity != null ? severity.getPriority() : Severity.MINIMAL.getPriority();
    }
}
