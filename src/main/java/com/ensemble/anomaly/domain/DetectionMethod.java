package com.ensemble.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Method that flagged a record. Part of the deduplication key together with the record index.
 */
public enum DetectionMethod {
    /** Short average path length in randomized partition trees. */
    ISOLATION_FOREST("isolation_forest"),
    /** Local density much lower than its neighbors' density. */
    LOCAL_OUTLIER_FACTOR("local_outlier_factor"),
    /** Outside the approximate one-class kernel boundary. */
    ONE_CLASS_SVM("one_class_svm"),
    /** Amount or fraud score unusual for the merchant category. */
    CONTEXTUAL_CATEGORY("contextual_category"),
    /** Amount unusual for the merchant state. */
    CONTEXTUAL_STATE("contextual_state"),
    /** Amount unusual for the transaction type. */
    CONTEXTUAL_TYPE("contextual_type"),
    /** Amount unusual against the preceding rolling window. */
    TEMPORAL_PATTERN("temporal_pattern"),
    /** Amount unusual for its calendar month. */
    SEASONAL_ANOMALY("seasonal_anomaly"),
    /** Amount far from the linear trend. */
    TREND_ANOMALY("trend_anomaly"),
    /** Actor inside a connected cluster of fraud-flagged transactions. */
    FRAUD_CLUSTER("fraud_cluster"),
    /** Transaction of a merchant whose fraud rate is an outlier. */
    MERCHANT_ANOMALY("merchant_anomaly"),
    /** Transaction of a customer with high fraud rate or low merchant diversity. */
    CUSTOMER_ANOMALY("customer_anomaly");

    private final String wireName;

    DetectionMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
