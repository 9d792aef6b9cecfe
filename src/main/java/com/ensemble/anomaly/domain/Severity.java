package com.ensemble.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity band of an anomaly finding. Drives prioritization (critical first).
 */
public enum Severity {
    CRITICAL("critical", 1),
    HIGH("high", 2),
    MEDIUM("medium", 3),
    LOW("low", 4),
    MINIMAL("minimal", 5);

    private final String wireName;
    private final int priority;

    Severity(String wireName, int priority) {
        this.wireName = wireName;
        this.priority = priority;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** 1 = most urgent, 5 = least. */
    public int getPriority() {
        return priority;
    }
}
