package com.ensemble.anomaly.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Worker pool for the detector fan-out. Sized to the number of detectors at most, since each run
 * submits one task per detector.
 */
@Slf4j
@Configuration
public class DetectionConfig {

    private static final int MAX_DETECTOR_THREADS = 6;

    @Bean(name = "detectionExecutor", destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(DetectionProperties properties) {
        int threads = properties.getParallelism() > 0
                ? properties.getParallelism()
                : Math.min(Runtime.getRuntime().availableProcessors(), MAX_DETECTOR_THREADS);
        log.info("Detection executor: threads={}, parallel={}", threads, properties.isParallel());
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("anomaly-detector-"));
    }
}
