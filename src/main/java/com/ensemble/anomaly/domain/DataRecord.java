package com.ensemble.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One input row: field name to value (number, string, boolean or null). Immutable.
 * Identity is positional, i.e. the index of the record in the list handed to the engine.
 */
@EqualsAndHashCode
@ToString
public final class DataRecord {

    private final Map<String, Object> fields;

    private DataRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static DataRecord of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        return new DataRecord(new LinkedHashMap<>(fields));
    }

    /** Raw value, or null when the field is absent. */
    public Object get(String field) {
        return fields.get(field);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return fields;
    }
}
