package com.ensemble.anomaly.detector;

import com.ensemble.anomaly.config.DetectionProperties;
import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.domain.DetectionMethod;
import com.ensemble.anomaly.engine.FindingPrioritizer;
import com.ensemble.anomaly.engine.SeverityClassifier;
import com.ensemble.anomaly.features.RecordFeatures;
import com.ensemble.anomaly.stats.NumericUtils;
import com.ensemble.anomaly.stats.PeerStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Flags records whose amount (or fraud score, within a merchant category) is far from what their
 * peers in the same category, state or transaction type show.
 * <p>
 * Each record is scored against the mean and standard deviation of the other members of its group.
 * Including the record itself caps |z| at (n-1)/sqrt(n), which hides outliers in small groups.
 */
@Slf4j
@Component
@Order(4)
@RequiredArgsConstructor
public class ContextualDetector implements AnomalyDetector {

    private final DetectionProperties properties;

    @Override
    public List<AnomalyFinding> detect(List<DataRecord> records) {
        List<AnomalyFinding> findings = new ArrayList<>();
        findings.addAll(detectByGroup(records, RecordFeatures.MERCHANT_CATEGORY, "category",
                DetectionMethod.CONTEXTUAL_CATEGORY, true));
        findings.addAll(detectByGroup(records, RecordFeatures.MERCHANT_STATE, "state",
                DetectionMethod.CONTEXTUAL_STATE, false));
        findings.addAll(detectByGroup(records, RecordFeatures.TRANSACTION_TYPE, "type",
                DetectionMethod.CONTEXTUAL_TYPE, false));
        List<AnomalyFinding> unique = FindingPrioritizer.deduplicate(findings);
        log.debug("Contextual: flagged={} of {}", unique.size(), records.size());
        return unique;
    }

    private List<AnomalyFinding> detectByGroup(List<DataRecord> records, String groupField, String groupLabel,
                                               DetectionMethod method, boolean includeFraudScore) {
        DetectionProperties.Contextual config = properties.getContextual();
        List<AnomalyFinding> findings = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> group : groupBy(records, groupField).entrySet()) {
            List<Integer> members = group.getValue();
            PeerStatistics amounts = PeerStatistics.of(values(records, members, RecordFeatures.AMOUNT));
            PeerStatistics fraudScores = includeFraudScore
                    ? PeerStatistics.of(values(records, members, RecordFeatures.FRAUD_SCORE))
                    : null;

            for (int pos = 0; pos < members.size(); pos++) {
                Optional<PeerStatistics.Moments> amountMoments = amounts.excluding(pos);
                OptionalDouble amountZ = amountMoments.isPresent()
                        ? NumericUtils.absZScore(amounts.valueAt(pos), amountMoments.get().getMean(), amountMoments.get().getStd())
                        : OptionalDouble.empty();
                Optional<PeerStatistics.Moments> fraudMoments = fraudScores != null ? fraudScores.excluding(pos) : Optional.empty();
                OptionalDouble fraudZ = fraudMoments.isPresent()
                        ? NumericUtils.absZScore(fraudScores.valueAt(pos), fraudMoments.get().getMean(), fraudMoments.get().getStd())
                        : OptionalDouble.empty();

                double maxZ = Math.max(amountZ.orElse(0.0), fraudZ.orElse(0.0));
                if (maxZ <= config.getZScoreThreshold()) {
                    continue;
                }
                int recordIndex = members.get(pos);
                Map<String, Object> context = FindingContexts.forRecord(records.get(recordIndex));
                context.put(groupLabel, group.getKey());
                amountMoments.ifPresent(m -> context.put("expectedAmountRange",
                        FindingContexts.range(m.getMean(), m.getStd(), config.getRangeMultiplier())));
                fraudMoments.ifPresent(m -> context.put("expectedFraudRange",
                        FindingContexts.range(m.getMean(), m.getStd(), config.getRangeMultiplier())));
                amountZ.ifPresent(z -> context.put("amountZScore", z));
                fraudZ.ifPresent(z -> context.put("fraudZScore", z));

                double score = maxZ / config.getScoreDivisor();
                findings.add(AnomalyFinding.builder()
                        .recordIndex(recordIndex)
                        .score(score)
                        .method(method)
                        .severity(SeverityClassifier.classify(score))
                        .context(FindingContexts.freeze(context))
                        .build());
            }
        }
        return findings;
    }

    /** Group value to original indices, in first-seen order. Records without the field are left out. */
    static Map<String, List<Integer>> groupBy(List<DataRecord> records, String field) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            int index = i;
            RecordFeatures.text(records.get(i), field)
                    .ifPresent(key -> groups.computeIfAbsent(key, k -> new ArrayList<>()).add(index));
        }
        return groups;
    }

    private static double[] values(List<DataRecord> records, List<Integer> members, String field) {
        double[] values = new double[members.size()];
        for (int pos = 0; pos < values.length; pos++) {
            OptionalDouble v = RecordFeatures.numeric(records.get(members.get(pos)), field);
            values[pos] = v.isPresent() ? v.getAsDouble() : Double.NaN;
        }
        return values;
    }

    @Override
    public String getDetectorName() {
        return "Contextual";
    }
}
