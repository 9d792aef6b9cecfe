package com.ensemble.anomaly.engine;

import com.ensemble.anomaly.config.DetectionProperties;
import com.ensemble.anomaly.detector.AnomalyDetector;
import com.ensemble.anomaly.detector.ContextualDetector;
import com.ensemble.anomaly.detector.GraphBasedDetector;
import com.ensemble.anomaly.detector.IsolationForestDetector;
import com.ensemble.anomaly.detector.LocalOutlierFactorDetector;
import com.ensemble.anomaly.detector.OneClassSeparationDetector;
import com.ensemble.anomaly.detector.TemporalDetector;
import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.domain.DetectionMethod;
import com.ensemble.anomaly.domain.DetectionReport;
import com.ensemble.anomaly.domain.Severity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static com.ensemble.anomaly.RecordFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AnomalyOrchestrator: failure isolation, validation, merging and ranking.
 */
class AnomalyOrchestratorTest {

    private DetectionProperties properties;
    private AnomalyReportBuilder reportBuilder;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        properties = new DetectionProperties();
        reportBuilder = new AnomalyReportBuilder(properties);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static AnomalyDetector detector(String name, AnomalyFinding... findings) {
        AnomalyDetector detector = mock(AnomalyDetector.class);
        when(detector.getDetectorName()).thenReturn(name);
        when(detector.detect(anyList())).thenReturn(List.of(findings));
        return detector;
    }

    private static AnomalyFinding finding(int index, DetectionMethod method, double score) {
        return AnomalyFinding.builder()
                .recordIndex(index)
                .method(method)
                .score(score)
                .severity(SeverityClassifier.classify(score))
                .context(Map.of())
                .build();
    }

    private static List<DataRecord> records(int n) {
        List<DataRecord> records = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            records.add(record("amount", 10 * i));
        }
        return records;
    }

    @Test
    void emptyInputReturnsWellFormedEmptyReport() {
        AnomalyDetector forest = detector("IsolationForest");
        AnomalyOrchestrator orchestrator = new AnomalyOrchestrator(List.of(forest), reportBuilder, properties, executor);

        DetectionReport report = orchestrator.detectAnomalies(List.of());

        assertThat(report.getAnomalies()).isEmpty();
        assertThat(report.getPatterns()).isEmpty();
        assertThat(report.getSummary().getTotalAnomalies()).isZero();
        assertThat(report.getSummary().getDetectionRate()).isZero();
        verify(forest, never()).detect(any());
    }

    @Test
    void failingDetectorDoesNotSuppressTheOthers() {
        AnomalyDetector failing = mock(AnomalyDetector.class);
        when(failing.getDetectorName()).thenReturn("OneClassSeparation");
        when(failing.detect(anyList())).thenThrow(new IllegalStateException("kernel blew up"));

        List<AnomalyDetector> detectors = List.of(
                detector("IsolationForest", finding(0, DetectionMethod.ISOLATION_FOREST, 0.9)),
                detector("LocalOutlierFactor", finding(1, DetectionMethod.LOCAL_OUTLIER_FACTOR, 2.0)),
                failing,
                detector("Contextual", finding(2, DetectionMethod.CONTEXTUAL_CATEGORY, 0.7)),
                detector("Temporal", finding(3, DetectionMethod.SEASONAL_ANOMALY, 0.5)),
                detector("GraphBased", finding(4, DetectionMethod.FRAUD_CLUSTER, 1.0)));
        AnomalyOrchestrator orchestrator = new AnomalyOrchestrator(detectors, reportBuilder, properties, executor);

        DetectionReport report = orchestrator.detectAnomalies(records(5));

        assertThat(report.getAnomalies()).extracting(AnomalyFinding::getMethod).containsExactlyInAnyOrder(
                DetectionMethod.ISOLATION_FOREST, DetectionMethod.LOCAL_OUTLIER_FACTOR,
                DetectionMethod.CONTEXTUAL_CATEGORY, DetectionMethod.SEASONAL_ANOMALY, DetectionMethod.FRAUD_CLUSTER);
        assertThat(report.getSummary().getDetectionRate()).isEqualTo(1.0);
    }

    @Test
    void errorFromDetectorIsIsolatedInSequentialMode() {
        properties.setParallel(false);
        AnomalyDetector overflowing = mock(AnomalyDetector.class);
        when(overflowing.getDetectorName()).thenReturn("GraphBased");
        when(overflowing.detect(anyList())).thenThrow(new StackOverflowError("deep"));
        AnomalyDetector exhausted = mock(AnomalyDetector.class);
        when(exhausted.getDetectorName()).thenReturn("LocalOutlierFactor");
        when(exhausted.detect(anyList())).thenThrow(new OutOfMemoryError("distance matrix"));
        AnomalyDetector working = detector("Contextual", finding(1, DetectionMethod.CONTEXTUAL_TYPE, 0.7));
        AnomalyOrchestrator orchestrator = new AnomalyOrchestrator(
                List.of(overflowing, exhausted, working), reportBuilder, properties);

        DetectionReport report = orchestrator.detectAnomalies(records(3));

        assertThat(report.getAnomalies()).singleElement().satisfies(f -> {
            assertThat(f.getRecordIndex()).isEqualTo(1);
            assertThat(f.getMethod()).isEqualTo(DetectionMethod.CONTEXTUAL_TYPE);
        });
        verify(working).detect(anyList());
    }

    @Test
    void invalidFindingsAreDropped() {
        AnomalyDetector sloppy = detector("Sloppy",
                finding(-1, DetectionMethod.ISOLATION_FOREST, 0.9),
                finding(3, DetectionMethod.ISOLATION_FOREST, 0.9),
                finding(1, DetectionMethod.LOCAL_OUTLIER_FACTOR, Double.NaN),
                finding(2, DetectionMethod.ONE_CLASS_SVM, Double.POSITIVE_INFINITY),
                finding(0, DetectionMethod.TREND_ANOMALY, 0.45));
        AnomalyOrchestrator orchestrator = new AnomalyOrchestrator(List.of(sloppy), reportBuilder, properties);

        DetectionReport report = orchestrator.detectAnomalies(records(3));

        assertThat(report.getAnomalies()).singleElement().satisfies(f -> {
            assertThat(f.getRecordIndex()).isZero();
            assertThat(f.getMethod()).isEqualTo(DetectionMethod.TREND_ANOMALY);
        });
    }

    @Test
    void nullResultCountsAsNoFindings() {
        AnomalyDetector broken = mock(AnomalyDetector.class);
        when(broken.getDetectorName()).thenReturn("Broken");
        when(broken.detect(anyList())).thenReturn(null);
        AnomalyDetector working = detector("Working", finding(1, DetectionMethod.CUSTOMER_ANOMALY, 0.3));
        AnomalyOrchestrator orchestrator = new AnomalyOrchestrator(List.of(broken, working), reportBuilder, properties, executor);

        assertThat(orchestrator.detectAnomalies(records(2)).getAnomalies()).hasSize(1);
    }

    @Test
    void findingsAreDeduplicatedAndRanked() {
        AnomalyDetector first = detector("First",
                finding(0, DetectionMethod.MERCHANT_ANOMALY, 0.3),
                finding(1, DetectionMethod.MERCHANT_ANOMALY, 0.65));
        AnomalyDetector second = detector("Second",
                finding(0, DetectionMethod.MERCHANT_ANOMALY, 0.95),
                finding(2, DetectionMethod.FRAUD_CLUSTER, 0.85),
                finding(1, DetectionMethod.TEMPORAL_PATTERN, 0.7));
        AnomalyOrchestrator orchestrator = new AnomalyOrchestrator(List.of(first, second), reportBuilder, properties, executor);

        List<AnomalyFinding> anomalies = orchestrator.detectAnomalies(records(3)).getAnomalies();

        assertThat(anomalies).extracting(AnomalyFinding::getSeverity)
                .containsExactly(Severity.CRITICAL, Severity.HIGH, Severity.HIGH, Severity.LOW);
        assertThat(anomalies).extracting(AnomalyFinding::getScore).containsExactly(0.85, 0.7, 0.65, 0.3);
    }

    @Test
    void sequentialModeRunsOnCallerThread() {
        properties.setParallel(false);
        AtomicReference<Thread> ranOn = new AtomicReference<>();
        AnomalyDetector detector = mock(AnomalyDetector.class);
        when(detector.getDetectorName()).thenReturn("CallerThread");
        when(detector.detect(anyList())).thenAnswer(invocation -> {
            ranOn.set(Thread.currentThread());
            return List.of();
        });
        AnomalyOrchestrator orchestrator = new AnomalyOrchestrator(List.of(detector), reportBuilder, properties, executor);

        DetectionReport report = orchestrator.detectAnomalies(records(4));

        assertThat(ranOn.get()).isSameAs(Thread.currentThread());
        assertThat(report.getAnomalies()).isEmpty();
        assertThat(report.getSummary().getDetectionRate()).isZero();
    }

    private static List<DataRecord> mixedTransactions() {
        List<DataRecord> records = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            records.add(record("merchant_category", "electronics", "merchant_state", "WA",
                    "amount", 50 + 10 * i, "fraud_score", 0.1, "customer_id", "C" + i, "merchant_id", "M" + (i % 3),
                    "transaction_date", "2024-05-" + String.format("%02d", i + 1), "is_fraud", 0));
        }
        records.add(record("merchant_category", "electronics", "amount", 50_000, "customer_id", "X", "merchant_id", "M9", "is_fraud", 1));
        records.add(record("merchant_category", "electronics", "amount", 50_000, "customer_id", "Y", "merchant_id", "M9", "is_fraud", 1));
        return records;
    }

    private static List<String> signatures(DetectionReport report) {
        return report.getAnomalies().stream()
                .map(f -> f.getRecordIndex() + "/" + f.getMethod() + "/" + f.getScore())
                .collect(Collectors.toList());
    }

    private List<AnomalyDetector> realDetectors() {
        return List.of(
                new IsolationForestDetector(properties, () -> new Random(7)),
                new LocalOutlierFactorDetector(properties),
                new OneClassSeparationDetector(properties),
                new ContextualDetector(properties),
                new TemporalDetector(properties),
                new GraphBasedDetector(properties));
    }

    @Test
    void endToEndWithRealDetectorsKeepsIndicesValid() {
        List<DataRecord> records = mixedTransactions();
        AnomalyOrchestrator orchestrator = new AnomalyOrchestrator(realDetectors(), reportBuilder, properties, executor);

        DetectionReport report = orchestrator.detectAnomalies(records);

        assertThat(report.getAnomalies()).allSatisfy(f -> assertThat(f.getRecordIndex()).isBetween(0, 11));
        assertThat(report.getAnomalies())
                .filteredOn(f -> f.getMethod() == DetectionMethod.CONTEXTUAL_CATEGORY)
                .extracting(AnomalyFinding::getRecordIndex)
                .containsExactlyInAnyOrder(10, 11);
        assertThat(report.getSummary().getTotalAnomalies()).isEqualTo(report.getAnomalies().size());
        assertThat(orchestrator.getDetectorNames()).containsExactly(
                "IsolationForest", "LocalOutlierFactor", "OneClassSeparation", "Contextual", "Temporal", "GraphBased");
    }

    @Test
    void failingRealDetectorLeavesTheOtherFiveFindingsIntact() {
        List<DataRecord> records = mixedTransactions();
        List<AnomalyDetector> detectors = new ArrayList<>(realDetectors());
        AnomalyDetector failing = mock(AnomalyDetector.class);
        when(failing.getDetectorName()).thenReturn("OneClassSeparation");
        when(failing.detect(anyList())).thenThrow(new IllegalStateException("kernel blew up"));
        detectors.set(2, failing);
        List<AnomalyDetector> otherFive = new ArrayList<>(detectors);
        otherFive.remove(2);

        DetectionReport withFailure = new AnomalyOrchestrator(detectors, reportBuilder, properties, executor)
                .detectAnomalies(records);
        DetectionReport withoutIt = new AnomalyOrchestrator(otherFive, reportBuilder, properties, executor)
                .detectAnomalies(records);

        assertThat(withFailure.getAnomalies()).isNotEmpty();
        assertThat(signatures(withFailure)).containsExactlyElementsOf(signatures(withoutIt));
        assertThat(withFailure.getAnomalies()).extracting(AnomalyFinding::getMethod)
                .doesNotContain(DetectionMethod.ONE_CLASS_SVM)
                .contains(DetectionMethod.CONTEXTUAL_CATEGORY);
    }
}
