package com.ensemble.anomaly.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Counts over the final (deduplicated) findings.
 */
@Value
@Builder
public class DetectionSummary {

    int totalAnomalies;
    Map<String, Long> severityDistribution;
    Map<String, Long> methodDistribution;
    Map<String, Long> categoryDistribution;
    /** Findings per input record; 0 for empty input. Can exceed 1 when several methods flag a record. */
    double detectionRate;
}
