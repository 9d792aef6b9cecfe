package com.ensemble.anomaly.detector;

import com.ensemble.anomaly.config.DetectionProperties;
import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.domain.DetectionMethod;
import com.ensemble.anomaly.engine.SeverityClassifier;
import com.ensemble.anomaly.features.FeatureVector;
import com.ensemble.anomaly.stats.NumericUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Local outlier factor: compares a record's local reachability density with that of its k nearest
 * neighbors. O(n²) in time and memory; callers are expected to hand in bounded (sampled) inputs.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class LocalOutlierFactorDetector implements AnomalyDetector {

    /** Keeps densities finite when a record has duplicates at distance 0. */
    static final double DENSITY_EPSILON = 1e-10;

    private final DetectionProperties properties;

    @Override
    public List<AnomalyFinding> detect(List<DataRecord> records) {
        return detect(records, properties.getLof().getK());
    }

    public List<AnomalyFinding> detect(List<DataRecord> records, int k) {
        int n = records.size();
        if (n < 2 || k < 1) {
            return List.of();
        }
        int effectiveK = Math.min(k, n - 1);
        double[][] distances = NumericUtils.distanceMatrix(FeatureVector.ofAll(records));

        int[][] neighbors = new int[n][];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            neighbors[i] = nearestNeighbors(distances, i, effectiveK);
            kDistance[i] = distances[i][neighbors[i][effectiveK - 1]];
        }

        double[] lrd = new double[n];
        for (int i = 0; i < n; i++) {
            double reachSum = 0.0;
            for (int neighbor : neighbors[i]) {
                reachSum += Math.max(kDistance[neighbor], distances[i][neighbor]);
            }
            lrd[i] = 1.0 / (reachSum / effectiveK + DENSITY_EPSILON);
        }

        DetectionProperties.Lof config = properties.getLof();
        List<AnomalyFinding> findings = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double neighborLrdSum = 0.0;
            for (int neighbor : neighbors[i]) {
                neighborLrdSum += lrd[neighbor];
            }
            double lof = (neighborLrdSum / effectiveK) / lrd[i];
            if (Double.isFinite(lof) && lof > config.getThreshold()) {
                Map<String, Object> context = FindingContexts.forRecord(records.get(i));
                context.put("lof", lof);
                context.put("neighbors", effectiveK);
                findings.add(AnomalyFinding.builder()
                        .recordIndex(i)
                        .score(lof)
                        .method(DetectionMethod.LOCAL_OUTLIER_FACTOR)
                        .severity(SeverityClassifier.classify(
                                NumericUtils.clamp(lof / config.getSeverityDivisor(), 0.0, 1.0)))
                        .context(FindingContexts.freeze(context))
                        .build());
            }
        }
        log.debug("LOF: k={}, flagged={} of {}", effectiveK, findings.size(), n);
        return findings;
    }

    /** Indices of the k closest other records, nearest first; ties broken by index. */
    static int[] nearestNeighbors(double[][] distances, int point, int k) {
        return IntStream.range(0, distances.length)
                .filter(j -> j != point)
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(j -> distances[point][j]).thenComparingInt(j -> j))
                .limit(k)
                .mapToInt(Integer::intValue)
                .toArray();
    }

    @Override
    public String getDetectorName() {
        return "LocalOutlierFactor";
    }
}
