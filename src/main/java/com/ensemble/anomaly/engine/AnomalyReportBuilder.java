package com.ensemble.anomaly.engine;

import com.ensemble.anomaly.config.DetectionProperties;
import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.AnomalyPattern;
import com.ensemble.anomaly.domain.DetectionMethod;
import com.ensemble.anomaly.domain.DetectionReport;
import com.ensemble.anomaly.domain.DetectionSummary;
import com.ensemble.anomaly.domain.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the summary and pattern list over prioritized findings. Safe on empty input
 * (rates are 0, lists are empty).
 */
@Component
@RequiredArgsConstructor
public class AnomalyReportBuilder {

    static final String HIGH_VALUE = "high_value_anomalies";
    static final String GEOGRAPHIC = "geographic_clustering";
    static final String TEMPORAL = "temporal_clustering";

    private final DetectionProperties properties;

    public DetectionReport build(List<AnomalyFinding> prioritized, int recordCount) {
        return DetectionReport.builder()
                .anomalies(List.copyOf(prioritized))
                .summary(summarize(prioritized, recordCount))
                .patterns(findPatterns(prioritized))
                .build();
    }

    public DetectionSummary summarize(List<AnomalyFinding> findings, int recordCount) {
        Map<String, Long> bySeverity = countBy(findings, f -> f.getSeverity().getWireName());
        Map<String, Long> byMethod = countBy(findings, f -> f.getMethod().getWireName());
        Map<String, Long> byCategory = countBy(
                findings.stream().filter(f -> contextText(f, "category") != null).collect(Collectors.toList()),
                f -> contextText(f, "category"));
        return DetectionSummary.builder()
                .totalAnomalies(findings.size())
                .severityDistribution(orderBySeverity(bySeverity))
                .methodDistribution(byMethod)
                .categoryDistribution(byCategory)
                .detectionRate(recordCount > 0 ? (double) findings.size() / recordCount : 0.0)
                .build();
    }

    public List<AnomalyPattern> findPatterns(List<AnomalyFinding> findings) {
        DetectionProperties.Patterns config = properties.getPatterns();
        List<AnomalyPattern> patterns = new ArrayList<>();

        long highValue = findings.stream()
                .filter(f -> contextNumber(f, "amount") > config.getHighValueAmount())
                .count();
        if (highValue > 0) {
            patterns.add(AnomalyPattern.builder()
                    .type(HIGH_VALUE)
                    .count((int) highValue)
                    .description("Anomalies involving high-value transactions")
                    .risk("high")
                    .build());
        }

        List<AnomalyPattern.StateCount> hotStates = countBy(
                findings.stream().filter(f -> contextText(f, "state") != null).collect(Collectors.toList()),
                f -> contextText(f, "state"))
                .entrySet().stream()
                .filter(e -> e.getValue() > config.getGeographicMinCount())
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .map(e -> new AnomalyPattern.StateCount(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
        if (!hotStates.isEmpty()) {
            patterns.add(AnomalyPattern.builder()
                    .type(GEOGRAPHIC)
                    .count(hotStates.size())
                    .states(hotStates)
                    .description("Geographic clustering of anomalies")
                    .risk("medium")
                    .build());
        }

        // rolling-window findings only; seasonal and trend findings do not count
        long temporal = findings.stream()
                .filter(f -> f.getMethod() == DetectionMethod.TEMPORAL_PATTERN)
                .count();
        if (temporal > config.getTemporalMinCount()) {
            patterns.add(AnomalyPattern.builder()
                    .type(TEMPORAL)
                    .count((int) temporal)
                    .description("Temporal clustering of anomalies")
                    .risk("medium")
                    .build());
        }
        return patterns;
    }

    private static Map<String, Long> countBy(List<AnomalyFinding> findings, Function<AnomalyFinding, String> key) {
        return findings.stream()
                .collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.counting()));
    }

    private static Map<String, Long> orderBySeverity(Map<String, Long> counts) {
        Map<String, Long> ordered = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            Long count = counts.get(severity.getWireName());
            if (count != null) ordered.put(severity.getWireName(), count);
        }
        return ordered;
    }

    private static String contextText(AnomalyFinding finding, String key) {
        if (finding.getContext() == null) return null;
        Object value = finding.getContext().get(key);
        return value != null ? value.toString() : null;
    }

    /** NaN when the value is absent or not numeric, which fails every comparison. */
    private static double contextNumber(AnomalyFinding finding, String key) {
        if (finding.getContext() == null) return Double.NaN;
        Object value = finding.getContext().get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : Double.NaN;
    }
}
