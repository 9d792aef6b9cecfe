package com.ensemble.anomaly.detector;

import com.ensemble.anomaly.config.DetectionProperties;
import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.domain.Severity;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static com.ensemble.anomaly.RecordFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for LocalOutlierFactorDetector.
 */
class LocalOutlierFactorDetectorTest {

    private final LocalOutlierFactorDetector detector = new LocalOutlierFactorDetector(new DetectionProperties());

    private static List<DataRecord> amounts(double... values) {
        return Arrays.stream(values).mapToObj(v -> record("amount", v)).collect(Collectors.toList());
    }

    @Test
    void isolatedPointHasHighLof() {
        List<AnomalyFinding> findings = detector.detect(amounts(10, 11, 12, 13, 14, 100), 3);

        assertThat(findings).hasSize(1);
        AnomalyFinding finding = findings.get(0);
        assertThat(finding.getRecordIndex()).isEqualTo(5);
        assertThat(finding.getScore()).isCloseTo(37.286, within(0.01));
        assertThat(finding.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(finding.getContext()).containsEntry("neighbors", 3);
    }

    @Test
    void kIsClippedToAvailableNeighbors() {
        // k = 10 clips to 5: every neighborhood is the whole set, so densities even out
        List<AnomalyFinding> findings = detector.detect(amounts(10, 11, 12, 13, 14, 100));
        assertThat(findings).isEmpty();
    }

    @Test
    void duplicatePointsStayFinite() {
        List<AnomalyFinding> findings = detector.detect(amounts(5, 5, 5, 5, 5, 5), 3);
        assertThat(findings).isEmpty();
    }

    @Test
    void fewerThanTwoRecordsGiveNoFindings() {
        assertThat(detector.detect(List.of())).isEmpty();
        assertThat(detector.detect(amounts(1))).isEmpty();
    }

    @Test
    void nearestNeighborsBreaksTiesByIndex() {
        double[][] distances = {
                {0, 1, 1, 2},
                {1, 0, 3, 3},
                {1, 3, 0, 3},
                {2, 3, 3, 0}};
        assertThat(LocalOutlierFactorDetector.nearestNeighbors(distances, 0, 2)).containsExactly(1, 2);
        assertThat(LocalOutlierFactorDetector.nearestNeighbors(distances, 3, 3)).containsExactly(0, 1, 2);
    }
}
