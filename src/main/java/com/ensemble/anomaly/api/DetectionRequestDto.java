package com.ensemble.anomaly.api;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * REST request body: the records to score, each a flat {@code field -> value} object.
 * Values that are not numbers, strings or booleans are treated as missing by the detectors.
 */
@Data
public class DetectionRequestDto {

    @NotNull(message = "records is required")
    private List<Map<String, Object>> records;
}
