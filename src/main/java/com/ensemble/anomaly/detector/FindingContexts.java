package com.ensemble.anomaly.detector;

import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.features.RecordFeatures;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds finding context maps: the record's descriptive attributes plus method-specific values.
 * Pattern analysis reads "amount", "state" and "category" from here.
 */
public final class FindingContexts {

    private FindingContexts() {
    }

    /** Mutable context pre-filled with the record attributes that are present. */
    public static Map<String, Object> forRecord(DataRecord record) {
        Map<String, Object> context = new LinkedHashMap<>();
        RecordFeatures.text(record, RecordFeatures.MERCHANT_CATEGORY).ifPresent(v -> context.put("category", v));
        RecordFeatures.text(record, RecordFeatures.MERCHANT_STATE).ifPresent(v -> context.put("state", v));
        RecordFeatures.amount(record).ifPresent(v -> context.put("amount", v));
        RecordFeatures.fraudScore(record).ifPresent(v -> context.put("fraudScore", v));
        RecordFeatures.text(record, RecordFeatures.TRANSACTION_TYPE).ifPresent(v -> context.put("transactionType", v));
        RecordFeatures.text(record, RecordFeatures.MERCHANT_ID).ifPresent(v -> context.put("merchantId", v));
        RecordFeatures.text(record, RecordFeatures.CUSTOMER_ID).ifPresent(v -> context.put("customerId", v));
        return context;
    }

    public static Map<String, Object> freeze(Map<String, Object> context) {
        return Collections.unmodifiableMap(context);
    }

    public static double[] range(double mean, double std, double multiplier) {
        return new double[]{mean - multiplier * std, mean + multiplier * std};
    }
}
