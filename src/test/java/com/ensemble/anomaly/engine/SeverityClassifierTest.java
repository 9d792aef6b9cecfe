package com.ensemble.anomaly.engine;

import com.ensemble.anomaly.domain.Severity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SeverityClassifier.
 */
class SeverityClassifierTest {

    @Test
    void classifiesAtBandBoundaries() {
        assertThat(SeverityClassifier.classify(0.8)).isEqualTo(Severity.CRITICAL);
        assertThat(SeverityClassifier.classify(0.7999)).isEqualTo(Severity.HIGH);
        assertThat(SeverityClassifier.classify(0.6)).isEqualTo(Severity.HIGH);
        assertThat(SeverityClassifier.classify(0.4)).isEqualTo(Severity.MEDIUM);
        assertThat(SeverityClassifier.classify(0.2)).isEqualTo(Severity.LOW);
        assertThat(SeverityClassifier.classify(0.1999)).isEqualTo(Severity.MINIMAL);
        assertThat(SeverityClassifier.classify(7.5)).isEqualTo(Severity.CRITICAL);
        assertThat(SeverityClassifier.classify(-1)).isEqualTo(Severity.MINIMAL);
    }

    @Test
    void nanIsMinimal() {
        assertThat(SeverityClassifier.classify(Double.NaN)).isEqualTo(Severity.MINIMAL);
    }

    @Test
    void classificationIsMonotonic() {
        int previous = Integer.MAX_VALUE;
        for (int i = -10; i <= 120; i++) {
            int priority = SeverityClassifier.priority(SeverityClassifier.classify(i / 100.0));
            assertThat(priority).isLessThanOrEqualTo(previous);
            previous = priority;
        }
    }

    @Test
    void priorityRunsFromOneToFive() {
        assertThat(SeverityClassifier.priority(Severity.CRITICAL)).isEqualTo(1);
        assertThat(SeverityClassifier.priority(Severity.HIGH)).isEqualTo(2);
        assertThat(SeverityClassifier.priority(Severity.MEDIUM)).isEqualTo(3);
        assertThat(SeverityClassifier.priority(Severity.LOW)).isEqualTo(4);
        assertThat(SeverityClassifier.priority(Severity.MINIMAL)).isEqualTo(5);
        assertThat(SeverityClassifier.priority(null)).isEqualTo(5);
    }
}
