package com.ensemble.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Every threshold and divisor the detectors use, bound from {@code anomaly.detection.*}.
 * With the defaults below, a plain {@code new DetectionProperties()} is a
 * complete configuration for tests.
 */
@Data
@ConfigurationProperties(prefix = "anomaly.detection")
public class DetectionProperties {

    /** Run detectors concurrently; false runs them one after another on the caller thread. */
    private boolean parallel = true;
    /** Worker threads for the detector fan-out; 0 = min(available processors, 6). */
    private int parallelism = 0;

    private IsolationForest isolationForest = new IsolationForest();
    private Lof lof = new Lof();
    private OneClass oneClass = new OneClass();
    private Contextual contextual = new Contextual();
    private Temporal temporal = new Temporal();
    private Graph graph = new Graph();
    private Patterns patterns = new Patterns();

    @Data
    public static class IsolationForest {
        private int numTrees = 100;
        private int maxSampleSize = 256;
        private double scoreThreshold = 0.5;
        private double contamination = 0.1;
        /** Fixed seed for reproducible forests; null draws a fresh seed per run. */
        private Long seed;
    }

    @Data
    public static class Lof {
        private int k = 10;
        private double threshold = 1.5;
        /** LOF is divided by this before severity classification. */
        private double severityDivisor = 3.0;
    }

    @Data
    public static class OneClass {
        /** Expected outlier fraction subtracted from the mean kernel similarity. */
        private double nu = 0.1;
        /** RBF width sigma in exp(-d^2 / (2 sigma^2)). */
        private double kernelWidth = 1.0;
    }

    @Data
    public static class Contextual {
        private double zScoreThreshold = 3.0;
        private double scoreDivisor = 5.0;
        /** Expected range is mean +/- this many standard deviations. */
        private double rangeMultiplier = 2.0;
    }

    @Data
    public static class Temporal {
        private int windowSize = 100;
        private double zScoreThreshold = 3.0;
        private double scoreDivisor = 5.0;
        private double rangeMultiplier = 2.0;
        /** Trend residual must exceed this many global standard deviations. */
        private double trendDeviationMultiplier = 2.0;
    }

    @Data
    public static class Graph {
        /** Clusters need strictly more nodes than this. */
        private int minClusterSize = 2;
        private double merchantZScoreThreshold = 2.0;
        private double scoreDivisor = 5.0;
        private double customerFraudRateThreshold = 0.1;
        private double customerDiversityThreshold = 0.3;
    }

    @Data
    public static class Patterns {
        private double highValueAmount = 1000.0;
        /** A state needs strictly more findings than this to form a geographic cluster. */
        private int geographicMinCount = 5;
        /** Temporal clustering needs strictly more temporal findings than this. */
        private int temporalMinCount = 10;
    }
}
