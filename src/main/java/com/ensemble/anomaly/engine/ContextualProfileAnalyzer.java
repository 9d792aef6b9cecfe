package com.ensemble.anomaly.engine;

import com.ensemble.anomaly.domain.CategoryProfile;
import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.domain.MerchantProfile;
import com.ensemble.anomaly.features.RecordFeatures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Merchant and category risk profiles: average amount, fraud rate and spread across
 * categories, states and merchants.
 */
@Slf4j
@Component
public class ContextualProfileAnalyzer {

    public List<MerchantProfile> analyzeMerchants(List<DataRecord> records) {
        Map<String, Aggregate> byMerchant = aggregate(records, RecordFeatures.MERCHANT_ID);
        List<MerchantProfile> profiles = new ArrayList<>(byMerchant.size());
        byMerchant.forEach((merchantId, agg) -> {
            double avgAmount = agg.avgAmount();
            double fraudRate = agg.fraudRate();
            profiles.add(MerchantProfile.builder()
                    .merchantId(merchantId)
                    .transactionCount(agg.count)
                    .avgAmount(avgAmount)
                    .fraudRate(fraudRate)
                    .categoryDiversity(agg.categories.size())
                    .geographicDiversity(agg.states.size())
                    .risk(fraudRate * 0.7 + (avgAmount > 1000 ? 0.3 : 0.0))
                    .build());
        });
        log.debug("Profiled {} merchants from {} records", profiles.size(), records.size());
        return profiles;
    }

    public List<CategoryProfile> analyzeCategories(List<DataRecord> records) {
        Map<String, Aggregate> byCategory = aggregate(records, RecordFeatures.MERCHANT_CATEGORY);
        List<CategoryProfile> profiles = new ArrayList<>(byCategory.size());
        byCategory.forEach((category, agg) -> {
            double avgAmount = agg.avgAmount();
            double fraudRate = agg.fraudRate();
            profiles.add(CategoryProfile.builder()
                    .category(category)
                    .transactionCount(agg.count)
                    .avgAmount(avgAmount)
                    .fraudRate(fraudRate)
                    .merchantDiversity(agg.merchants.size())
                    .geographicDiversity(agg.states.size())
                    .risk(fraudRate * 0.6 + (avgAmount > 500 ? 0.4 : 0.0))
                    .build());
        });
        log.debug("Profiled {} categories from {} records", profiles.size(), records.size());
        return profiles;
    }

    private static Map<String, Aggregate> aggregate(List<DataRecord> records, String keyField) {
        Map<String, Aggregate> aggregates = new LinkedHashMap<>();
        for (DataRecord record : records) {
            Optional<String> key = RecordFeatures.text(record, keyField);
            if (key.isEmpty()) continue;
            aggregates.computeIfAbsent(key.get(), k -> new Aggregate()).add(record);
        }
        return aggregates;
    }

    private static final class Aggregate {
        int count;
        int fraudCount;
        double amountSum;
        int amountCount;
        final Set<String> categories = new HashSet<>();
        final Set<String> states = new HashSet<>();
        final Set<String> merchants = new HashSet<>();

        void add(DataRecord record) {
            count++;
            if (RecordFeatures.isFraud(record)) fraudCount++;
            OptionalDouble amount = RecordFeatures.amount(record);
            if (amount.isPresent()) {
                amountSum += amount.getAsDouble();
                amountCount++;
            }
            RecordFeatures.text(record, RecordFeatures.MERCHANT_CATEGORY).ifPresent(categories::add);
            RecordFeatures.text(record, RecordFeatures.MERCHANT_STATE).ifPresent(states::add);
            RecordFeatures.text(record, RecordFeatures.MERCHANT_ID).ifPresent(merchants::add);
        }

        double avgAmount() {
            return amountCount == 0 ? 0.0 : amountSum / amountCount;
        }

        double fraudRate() {
            return count == 0 ? 0.0 : (double) fraudCount / count;
        }
    }
}
