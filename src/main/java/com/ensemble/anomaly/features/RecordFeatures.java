package com.ensemble.anomaly.features;

import com.ensemble.anomaly.domain.DataRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Reads numeric and categorical fields off a record. Missing, blank or unparseable
 * values come back empty; nothing here throws on bad input.
 */
public final class RecordFeatures {

    public static final String AMOUNT = "amount";
    public static final String FRAUD_SCORE = "fraud_score";
    public static final String BALANCE = "balance";
    public static final String MERCHANT_CATEGORY = "merchant_category";
    public static final String MERCHANT_STATE = "merchant_state";
    public static final String TRANSACTION_TYPE = "transaction_type";
    public static final String MERCHANT_ID = "merchant_id";
    public static final String CUSTOMER_ID = "customer_id";
    public static final String TRANSACTION_ID = "transaction_id";
    public static final String TRANSACTION_DATE = "transaction_date";
    public static final String IS_FRAUD = "is_fraud";

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MM/dd/yyyy"));

    private RecordFeatures() {
    }

    public static OptionalDouble amount(DataRecord record) {
        return numeric(record, AMOUNT);
    }

    public static OptionalDouble fraudScore(DataRecord record) {
        return numeric(record, FRAUD_SCORE);
    }

    public static OptionalDouble balance(DataRecord record) {
        return numeric(record, BALANCE);
    }

    /**
     * Numeric value of a field. Strings are trimmed and may carry a leading "$" and
     * thousands separators. Non-finite values count as missing.
     */
    public static OptionalDouble numeric(DataRecord record, String field) {
        if (record == null) return OptionalDouble.empty();
        return parseNumber(record.get(field));
    }

    static OptionalDouble parseNumber(Object value) {
        if (value == null || value instanceof Boolean) return OptionalDouble.empty();
        double parsed;
        if (value instanceof Number) {
            parsed = ((Number) value).doubleValue();
        } else {
            String s = value.toString().trim().replace(",", "");
            if (s.startsWith("$")) s = s.substring(1).trim();
            if (s.isEmpty()) return OptionalDouble.empty();
            try {
                parsed = Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
    }

    /** Categorical value, trimmed; blank counts as missing. */
    public static Optional<String> text(DataRecord record, String field) {
        if (record == null) return Optional.empty();
        Object value = record.get(field);
        if (value == null) return Optional.empty();
        String s = value.toString().trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    /** "1", 1, true and "true" mark a fraudulent transaction. */
    public static boolean isFraud(DataRecord record) {
        if (record == null) return false;
        Object value = record.get(IS_FRAUD);
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number) return ((Number) value).doubleValue() == 1.0;
        String s = value.toString().trim();
        return "1".equals(s) || "true".equalsIgnoreCase(s);
    }

    public static Optional<LocalDateTime> transactionDate(DataRecord record) {
        if (record == null) return Optional.empty();
        return parseDate(record.get(TRANSACTION_DATE));
    }

    /**
     * Accepts ISO date, ISO date-time (with or without offset), "yyyy-MM-dd HH:mm[:ss]",
     * "MM/dd/yyyy" and epoch milliseconds. Offsets are normalized to UTC.
     */
    static Optional<LocalDateTime> parseDate(Object value) {
        if (value == null) return Optional.empty();
        if (value instanceof Number) {
            return Optional.of(LocalDateTime.ofInstant(
                    Instant.ofEpochMilli(((Number) value).longValue()), ZoneOffset.UTC));
        }
        String s = value.toString().trim();
        if (s.isEmpty()) return Optional.empty();
        Optional<LocalDateTime> parsed = tryParse(
                () -> OffsetDateTime.parse(s).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        for (int i = 0; parsed.isEmpty() && i < DATE_TIME_FORMATS.size(); i++) {
            DateTimeFormatter format = DATE_TIME_FORMATS.get(i);
            parsed = tryParse(() -> LocalDateTime.parse(s, format));
        }
        for (int i = 0; parsed.isEmpty() && i < DATE_FORMATS.size(); i++) {
            DateTimeFormatter format = DATE_FORMATS.get(i);
            parsed = tryParse(() -> LocalDate.parse(s, format).atStartOfDay());
        }
        if (parsed.isPresent()) return parsed;
        if (s.length() > 8 && s.length() <= 15 && s.chars().allMatch(Character::isDigit)) {
            return Optional.of(LocalDateTime.ofInstant(Instant.ofEpochMilli(Long.parseLong(s)), ZoneOffset.UTC));
        }
        return Optional.empty();
    }

    private static Optional<LocalDateTime> tryParse(Supplier<LocalDateTime> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
