package com.ensemble.anomaly.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Per-merchant aggregate used for contextual risk profiling.
 */
@Value
@Builder
public class MerchantProfile {

    String merchantId;
    int transactionCount;
    double avgAmount;
    double fraudRate;
    int categoryDiversity;
    int geographicDiversity;
    double risk;
}
