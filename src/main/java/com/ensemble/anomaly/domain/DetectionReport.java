package com.ensemble.anomaly.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one engine run: prioritized findings, summary and patterns.
 * Consumed by the insight/narrative layer and by the zero-results logging policy.
 */
@Value
@Builder
public class DetectionReport {

    List<AnomalyFinding> anomalies;
    DetectionSummary summary;
    List<AnomalyPattern> patterns;
}
