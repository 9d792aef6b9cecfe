package com.ensemble.anomaly.engine;

import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.DetectionMethod;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Deduplicates findings by (record index, method) and orders them for review.
 */
public final class FindingPrioritizer {

    /** Critical first, then higher score first. */
    public static final Comparator<AnomalyFinding> PRIORITY_ORDER =
            Comparator.<AnomalyFinding>comparingInt(f -> SeverityClassifier.priority(f.getSeverity()))
                    .thenComparing(AnomalyFinding::getScore, Comparator.reverseOrder());

    private FindingPrioritizer() {
    }

    /** Keeps the first finding for each (record index, method); input order is preserved. */
    public static List<AnomalyFinding> deduplicate(List<AnomalyFinding> findings) {
        Set<FindingKey> seen = new HashSet<>();
        List<AnomalyFinding> unique = new ArrayList<>(findings.size());
        for (AnomalyFinding finding : findings) {
            if (seen.add(new FindingKey(finding.getRecordIndex(), finding.getMethod()))) {
                unique.add(finding);
            }
        }
        return unique;
    }

    /** Stable sort by {@link #PRIORITY_ORDER}; returns a new list. */
    public static List<AnomalyFinding> prioritize(List<AnomalyFinding> findings) {
        List<AnomalyFinding> sorted = new ArrayList<>(findings);
        sorted.sort(PRIORITY_ORDER);
        return sorted;
    }

    private static final class FindingKey {
        private final int recordIndex;
        private final DetectionMethod method;

        private FindingKey(int recordIndex, DetectionMethod method) {
            this.recordIndex = recordIndex;
            this.method = method;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FindingKey)) return false;
            FindingKey other = (FindingKey) o;
            return recordIndex == other.recordIndex && method == other.method;
        }

        @Override
        public int hashCode() {
            return Objects.hash(recordIndex, method);
        }
    }
}
