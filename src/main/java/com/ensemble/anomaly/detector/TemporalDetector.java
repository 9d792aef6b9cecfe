package com.ensemble.anomaly.detector;

import com.ensemble.anomaly.config.DetectionProperties;
import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.domain.DetectionMethod;
import com.ensemble.anomaly.engine.SeverityClassifier;
import com.ensemble.anomaly.features.RecordFeatures;
import com.ensemble.anomaly.stats.LinearTrend;
import com.ensemble.anomaly.stats.NumericUtils;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Time-ordered amount analysis: rolling-window z-scores, per-calendar-month z-scores and residuals
 * from a linear trend. Only records with a parseable transaction date and amount take part.
 */
@Slf4j
@Component
@Order(5)
@RequiredArgsConstructor
public class TemporalDetector implements AnomalyDetector {

    private final DetectionProperties properties;

    @Override
    public List<AnomalyFinding> detect(List<DataRecord> records) {
        List<TimedAmount> series = chronological(records);
        List<AnomalyFinding> findings = new ArrayList<>();
        findings.addAll(detectRollingWindow(records, series));
        findings.addAll(detectSeasonal(records, series));
        findings.addAll(detectTrend(records, series));
        log.debug("Temporal: dated records={}, flagged={}", series.size(), findings.size());
        return findings;
    }

    /** Dated records with an amount, stably sorted ascending by date. */
    static List<TimedAmount> chronological(List<DataRecord> records) {
        List<TimedAmount> series = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            Optional<LocalDateTime> date = RecordFeatures.transactionDate(records.get(i));
            OptionalDouble amount = RecordFeatures.amount(records.get(i));
            if (date.isPresent() && amount.isPresent()) {
                series.add(new TimedAmount(i, date.get(), amount.getAsDouble()));
            }
        }
        // List.sort is a stable merge sort
        series.sort(Comparator.comparing(TimedAmount::getDate));
        return series;
    }

    /** Positions before the window size are never scored. */
    List<AnomalyFinding> detectRollingWindow(List<DataRecord> records, List<TimedAmount> series) {
        DetectionProperties.Temporal config = properties.getTemporal();
        int windowSize = config.getWindowSize();
        List<AnomalyFinding> findings = new ArrayList<>();
        if (windowSize < 1 || series.size() <= windowSize) {
            return findings;
        }
        double[] amounts = amountsOf(series);
        for (int i = windowSize; i < amounts.length; i++) {
            double mean = NumericUtils.mean(amounts, i - windowSize, i);
            double std = NumericUtils.populationStd(amounts, i - windowSize, i);
            OptionalDouble z = NumericUtils.absZScore(amounts[i], mean, std);
            if (z.isEmpty() || z.getAsDouble() <= config.getZScoreThreshold()) {
                continue;
            }
            TimedAmount point = series.get(i);
            Map<String, Object> context = FindingContexts.forRecord(records.get(point.getRecordIndex()));
            context.put("windowSize", windowSize);
            context.put("expectedRange", FindingContexts.range(mean, std, config.getRangeMultiplier()));
            context.put("zScore", z.getAsDouble());
            context.put("trend", point.getAmount() > mean ? "increasing" : "decreasing");
            findings.add(finding(point, z.getAsDouble() / config.getScoreDivisor(), DetectionMethod.TEMPORAL_PATTERN, context));
        }
        return findings;
    }

    /** Each calendar month (across years) is its own population. */
    List<AnomalyFinding> detectSeasonal(List<DataRecord> records, List<TimedAmount> series) {
        DetectionProperties.Temporal config = properties.getTemporal();
        Map<Integer, List<TimedAmount>> byMonth = new TreeMap<>();
        for (TimedAmount point : series) {
            byMonth.computeIfAbsent(point.getDate().getMonthValue(), m -> new ArrayList<>()).add(point);
        }
        List<AnomalyFinding> findings = new ArrayList<>();
        for (Map.Entry<Integer, List<TimedAmount>> month : byMonth.entrySet()) {
            double[] amounts = amountsOf(month.getValue());
            double mean = NumericUtils.mean(amounts);
            double std = NumericUtils.populationStd(amounts);
            for (TimedAmount point : month.getValue()) {
                OptionalDouble z = NumericUtils.absZScore(point.getAmount(), mean, std);
                if (z.isEmpty() || z.getAsDouble() <= config.getZScoreThreshold()) {
                    continue;
                }
                Map<String, Object> context = FindingContexts.forRecord(records.get(point.getRecordIndex()));
                context.put("month", month.getKey());
                context.put("expectedRange", FindingContexts.range(mean, std, config.getRangeMultiplier()));
                context.put("zScore", z.getAsDouble());
                findings.add(finding(point, z.getAsDouble() / config.getScoreDivisor(), DetectionMethod.SEASONAL_ANOMALY, context));
            }
        }
        return findings;
    }

    /** Least-squares line over sequence position; residuals beyond k global standard deviations. */
    List<AnomalyFinding> detectTrend(List<DataRecord> records, List<TimedAmount> series) {
        DetectionProperties.Temporal config = properties.getTemporal();
        List<AnomalyFinding> findings = new ArrayList<>();
        if (series.size() < 2) {
            return findings;
        }
        double[] amounts = amountsOf(series);
        double std = NumericUtils.populationStd(amounts);
        if (!NumericUtils.hasSpread(NumericUtils.mean(amounts), std)) {
            return findings;
        }
        LinearTrend trend = NumericUtils.fitTrend(amounts);
        double threshold = config.getTrendDeviationMultiplier() * std;
        for (int i = 0; i < amounts.length; i++) {
            double expected = trend.valueAt(i);
            double deviation = Math.abs(amounts[i] - expected);
            if (deviation <= threshold) {
                continue;
            }
            TimedAmount point = series.get(i);
            Map<String, Object> context = FindingContexts.forRecord(records.get(point.getRecordIndex()));
            context.put("expectedAmount", expected);
            context.put("deviation", deviation);
            context.put("trend", trend.getSlope() > 0 ? "increasing" : "decreasing");
            findings.add(finding(point, deviation / (config.getScoreDivisor() * std), DetectionMethod.TREND_ANOMALY, context));
        }
        return findings;
    }

    private static AnomalyFinding finding(TimedAmount point, double score, DetectionMethod method,
                                          Map<String, Object> context) {
        context.put("transactionDate", point.getDate().toString());
        return AnomalyFinding.builder()
                .recordIndex(point.getRecordIndex())
                .score(score)
                .method(method)
                .severity(SeverityClassifier.classify(score))
                .context(FindingContexts.freeze(context))
                .build();
    }

    private static double[] amountsOf(List<TimedAmount> points) {
        double[] amounts = new double[points.size()];
        for (int i = 0; i < amounts.length; i++) {
            amounts[i] = points.get(i).getAmount();
        }
        return amounts;
    }

    @Override
    public String getDetectorName() {
        return "Temporal";
    }

    @Value
    static class TimedAmount {
        int recordIndex;
        LocalDateTime date;
        double amount;
    }
}
