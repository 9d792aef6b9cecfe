package com.ensemble.anomaly.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Cross-finding pattern (high-value, geographic or temporal clustering).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyPattern {

    String type;
    Integer count;
    String description;
    String risk;
    /** Only for geographic clustering. */
    List<StateCount> states;

    @Value
    public static class StateCount {
        String state;
        long count;
    }
}
