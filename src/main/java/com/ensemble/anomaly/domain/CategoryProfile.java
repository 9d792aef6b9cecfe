package com.ensemble.anomaly.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Per-merchant-category aggregate used for contextual risk profiling.
 */
@Value
@Builder
public class CategoryProfile {

    String category;
    int transactionCount;
    double avgAmount;
    double fraudRate;
    int merchantDiversity;
    int geographicDiversity;
    double risk;
}
