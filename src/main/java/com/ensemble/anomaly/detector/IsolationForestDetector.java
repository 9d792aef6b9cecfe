package com.ensemble.anomaly.detector;

import com.ensemble.anomaly.config.DetectionProperties;
import com.ensemble.anomaly.detector.iforest.IsolationTree;
import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.domain.DetectionMethod;
import com.ensemble.anomaly.engine.SeverityClassifier;
import com.ensemble.anomaly.features.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Isolation forest over amount, fraud score and balance. Records that random splits isolate
 * quickly (short average path) score close to 1.
 */
@Slf4j
@Component
@Order(1)
public class IsolationForestDetector implements AnomalyDetector {

    private final DetectionProperties.IsolationForest config;
    private final Supplier<Random> randomSource;

    @Autowired
    public IsolationForestDetector(DetectionProperties properties) {
        this(properties, seededSource(properties.getIsolationForest().getSeed()));
    }

    /**
     * @param randomSource called once per run; trees draw their seeds from the returned generator
     */
    public IsolationForestDetector(DetectionProperties properties, Supplier<Random> randomSource) {
        this.config = properties.getIsolationForest();
        this.randomSource = randomSource;
    }

    private static Supplier<Random> seededSource(Long seed) {
        return seed != null ? () -> new Random(seed) : Random::new;
    }

    @Override
    public List<AnomalyFinding> detect(List<DataRecord> records) {
        return detect(records, config.getContamination());
    }

    /**
     * @param contamination assumed anomalous fraction; reported in the finding context, the flag
     *                      threshold is {@code anomaly.detection.isolation-forest.score-threshold}
     */
    public List<AnomalyFinding> detect(List<DataRecord> records, double contamination) {
        int n = records.size();
        int sampleSize = Math.min(config.getMaxSampleSize(), n);
        double normalizer = IsolationTree.expectedPathLength(sampleSize);
        if (normalizer <= 0.0) {
            log.debug("Isolation forest skipped: sample size {} too small to score", sampleSize);
            return List.of();
        }

        FeatureVector[] vectors = FeatureVector.ofAll(records);
        List<IsolationTree> forest = buildForest(vectors, sampleSize);

        List<AnomalyFinding> findings = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double total = 0.0;
            for (IsolationTree tree : forest) {
                total += tree.pathLength(vectors[i]);
            }
            double avgPathLength = total / forest.size();
            double score = Math.pow(2.0, -avgPathLength / normalizer);
            if (score > config.getScoreThreshold()) {
                Map<String, Object> context = FindingContexts.forRecord(records.get(i));
                context.put("avgPathLength", avgPathLength);
                context.put("contamination", contamination);
                findings.add(AnomalyFinding.builder()
                        .recordIndex(i)
                        .score(score)
                        .method(DetectionMethod.ISOLATION_FOREST)
                        .severity(SeverityClassifier.classify(score))
                        .context(FindingContexts.freeze(context))
                        .build());
            }
        }
        log.debug("Isolation forest: trees={}, sampleSize={}, flagged={} of {}",
                forest.size(), sampleSize, findings.size(), n);
        return findings;
    }

    /**
     * Seeds are drawn up front from one generator so trees can be grown in parallel and a fixed
     * seed still yields the same forest.
     */
    List<IsolationTree> buildForest(FeatureVector[] vectors, int sampleSize) {
        int numTrees = Math.max(1, config.getNumTrees());
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        Random master = randomSource.get();
        long[] seeds = new long[numTrees];
        for (int t = 0; t < numTrees; t++) {
            seeds[t] = master.nextLong();
        }
        return IntStream.range(0, numTrees)
                .parallel()
                .mapToObj(t -> {
                    Random random = new Random(seeds[t]);
                    return IsolationTree.build(sample(vectors, sampleSize, random), maxDepth, random);
                })
                .collect(Collectors.toList());
    }

    /** Partial Fisher–Yates shuffle: sampleSize distinct records. */
    private static List<FeatureVector> sample(FeatureVector[] vectors, int sampleSize, Random random) {
        int[] idx = IntStream.range(0, vectors.length).toArray();
        List<FeatureVector> sample = new ArrayList<>(sampleSize);
        for (int i = 0; i < sampleSize; i++) {
            int j = i + random.nextInt(idx.length - i);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
            sample.add(vectors[idx[i]]);
        }
        return sample;
    }

    @Override
    public String getDetectorName() {
        return "IsolationForest";
    }
}
