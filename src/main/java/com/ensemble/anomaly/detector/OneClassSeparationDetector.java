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
import java.util.List;
import java.util.Map;

/**
 * Approximate one-class boundary: mean RBF similarity of a record to all other records minus the
 * expected outlier fraction nu. A negative margin puts the record outside the boundary.
 */
@Slf4j
@Component
@Order(3)
@RequiredArgsConstructor
public class OneClassSeparationDetector implements AnomalyDetector {

    private final DetectionProperties properties;

    @Override
    public List<AnomalyFinding> detect(List<DataRecord> records) {
        int n = records.size();
        if (n < 2) {
            return List.of();
        }
        DetectionProperties.OneClass config = properties.getOneClass();
        double twoSigmaSq = 2.0 * config.getKernelWidth() * config.getKernelWidth();
        FeatureVector[] vectors = FeatureVector.ofAll(records);

        List<AnomalyFinding> findings = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double kernelSum = 0.0;
            for (int j = 0; j < n; j++) {
                if (j == i) continue;
                double d = NumericUtils.euclideanDistance(vectors[i], vectors[j]);
                kernelSum += Math.exp(-(d * d) / twoSigmaSq);
            }
            double margin = kernelSum / (n - 1) - config.getNu();
            if (margin < 0) {
                double score = Math.abs(margin);
                Map<String, Object> context = FindingContexts.forRecord(records.get(i));
                context.put("margin", margin);
                findings.add(AnomalyFinding.builder()
                        .recordIndex(i)
                        .score(score)
                        .method(DetectionMethod.ONE_CLASS_SVM)
                        .severity(SeverityClassifier.classify(score))
                        .context(FindingContexts.freeze(context))
                        .build());
            }
        }
        log.debug("One-class separation: nu={}, flagged={} of {}", config.getNu(), findings.size(), n);
        return findings;
    }

    @Override
    public String getDetectorName() {
        return "OneClassSeparation";
    }
}
