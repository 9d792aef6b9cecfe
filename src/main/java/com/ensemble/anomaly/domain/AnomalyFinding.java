package com.ensemble.anomaly.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A record flagged by one detection method. Context carries explanation data
 * (expected ranges, z-scores, cluster size, ...) and is never used for re-scoring.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyFinding {

    /** Index into the original input list. */
    int recordIndex;
    /** Usually normalized to roughly 0.0–1.0; LOF findings carry the raw factor. */
    double score;
    DetectionMethod method;
    Severity severity;
    Map<String, Object> context;
}
