package com.ensemble.anomaly.detector;

import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.DataRecord;

import java.util.List;

/**
 * One unsupervised detection strategy. Implementations are stateless between calls and must
 * only read the input list; every finding's record index refers to that list.
 */
public interface AnomalyDetector {

    /**
     * Score the records and return the flagged ones.
     *
     * @param records the full input, never mutated
     * @return findings, possibly empty, never null
     */
    List<AnomalyFinding> detect(List<DataRecord> records);

    /**
     * Detector name for logging and the detectors endpoint.
     */
    String getDetectorName();
}
