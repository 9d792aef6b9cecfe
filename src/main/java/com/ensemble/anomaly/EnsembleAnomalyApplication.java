package com.ensemble.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Ensemble Anomaly Engine. Provides:
 * <ul>
 *   <li>Six unsupervised detectors (isolation forest, LOF, one-class kernel, contextual, temporal, graph)</li>
 *   <li>Failure-isolated fan-out of detectors with deduplication and severity ranking</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EnsembleAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnsembleAnomalyApplication.class, args);
    }
}
