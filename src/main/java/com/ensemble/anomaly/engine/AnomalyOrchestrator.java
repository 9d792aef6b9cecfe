package com.ensemble.anomaly.engine;

import com.ensemble.anomaly.config.DetectionProperties;
import com.ensemble.anomaly.detector.AnomalyDetector;
import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.domain.DetectionReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Runs every detector on the same input, isolates detector failures, then merges,
 * deduplicates and ranks the findings and builds the report.
 */
@Slf4j
@Service
public class AnomalyOrchestrator {

    private final List<AnomalyDetector> detectors;
    private final AnomalyReportBuilder reportBuilder;
    private final DetectionProperties properties;
    private final ExecutorService executor;

    @Autowired
    public AnomalyOrchestrator(List<AnomalyDetector> detectors,
                               AnomalyReportBuilder reportBuilder,
                               DetectionProperties properties,
                               @Qualifier("detectionExecutor") ExecutorService executor) {
        this.detectors = List.copyOf(detectors);
        this.reportBuilder = reportBuilder;
        this.properties = properties;
        this.executor = executor;
        log.info("AnomalyOrchestrator initialized with {} detectors: {}, parallel={}",
                this.detectors.size(),
                this.detectors.stream().map(AnomalyDetector::getDetectorName).collect(Collectors.toList()),
                properties.isParallel() && executor != null);
    }

    /** Sequential orchestrator, no executor. */
    public AnomalyOrchestrator(List<AnomalyDetector> detectors,
                               AnomalyReportBuilder reportBuilder,
                               DetectionProperties properties) {
        this(detectors, reportBuilder, properties, null);
    }

    /**
     * Detect anomalies in {@code records}. Never throws because of a detector; a failing detector
     * is logged and contributes no findings.
     */
    public DetectionReport detectAnomalies(List<DataRecord> records) {
        if (records == null || records.isEmpty()) {
            log.info("Anomaly detection skipped: no records");
            return reportBuilder.build(List.of(), 0);
        }
        long start = System.currentTimeMillis();
        log.info("Starting anomaly detection on {} records with {} detectors", records.size(), detectors.size());
        List<DataRecord> input = List.copyOf(records);

        List<AnomalyFinding> all = properties.isParallel() && executor != null
                ? runParallel(input)
                : runSequential(input);

        List<AnomalyFinding> valid = validate(all, input.size());
        List<AnomalyFinding> prioritized = FindingPrioritizer.prioritize(FindingPrioritizer.deduplicate(valid));
        DetectionReport report = reportBuilder.build(prioritized, input.size());

        log.info("Anomaly detection completed: records={}, rawFindings={}, uniqueAnomalies={}, patterns={}, tookMs={}",
                input.size(), all.size(), prioritized.size(), report.getPatterns().size(),
                System.currentTimeMillis() - start);
        if (prioritized.isEmpty()) {
            log.warn("Anomaly detection returned zero results for {} records", input.size());
        }
        return report;
    }

    public List<String> getDetectorNames() {
        return detectors.stream().map(AnomalyDetector::getDetectorName).collect(Collectors.toList());
    }

    private List<AnomalyFinding> runSequential(List<DataRecord> records) {
        List<AnomalyFinding> all = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            all.addAll(runSafely(detector, records));
        }
        return all;
    }

    private List<AnomalyFinding> runParallel(List<DataRecord> records) {
        List<Future<List<AnomalyFinding>>> futures = new ArrayList<>(detectors.size());
        for (AnomalyDetector detector : detectors) {
            futures.add(executor.submit(() -> runSafely(detector, records)));
        }
        List<AnomalyFinding> all = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String name = detectors.get(i).getDetectorName();
            try {
                all.addAll(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("Detector {} failed; continuing without its findings", name, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for detector {}; remaining detectors contribute no findings", name);
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                break;
            }
        }
        return all;
    }

    private List<AnomalyFinding> runSafely(AnomalyDetector detector, List<DataRecord> records) {
        String name = detector.getDetectorName();
        long start = System.currentTimeMillis();
        try {
            List<AnomalyFinding> findings = detector.detect(records);
            if (findings == null) {
                log.warn("Detector {} returned null; treating as no findings", name);
                return List.of();
            }
            log.debug("Detector {} found {} anomalies in {}ms", name, findings.size(), System.currentTimeMillis() - start);
            return findings;
        } catch (Exception | StackOverflowError | OutOfMemoryError e) {
            log.error("Detector {} failed; continuing without its findings", name, e);
            return List.of();
        }
    }

    /** Drops findings with an out-of-range index, a non-finite score or missing method/severity. */
    private List<AnomalyFinding> validate(List<AnomalyFinding> findings, int recordCount) {
        List<AnomalyFinding> valid = new ArrayList<>(findings.size());
        int dropped = 0;
        for (AnomalyFinding finding : findings) {
            if (finding != null
                    && finding.getRecordIndex() >= 0 && finding.getRecordIndex() < recordCount
                    && Double.isFinite(finding.getScore())
                    && finding.getMethod() != null && finding.getSeverity() != null) {
                valid.add(finding);
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("Dropped {} invalid findings (bad record index, score, method or severity)", dropped);
        }
        return valid;
    }
}
