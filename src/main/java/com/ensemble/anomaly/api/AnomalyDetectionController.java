package com.ensemble.anomaly.api;

import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.domain.DetectionReport;
import com.ensemble.anomaly.engine.AnomalyOrchestrator;
import com.ensemble.anomaly.engine.ContextualProfileAnalyzer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API over the ensemble engine. Consumers post already-normalized records and get back
 * ranked findings with summary and patterns.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/anomalies")
@RequiredArgsConstructor
@Tag(name = "Anomalies", description = "Ensemble anomaly detection over transaction records")
public class AnomalyDetectionController {

    private final AnomalyOrchestrator orchestrator;
    private final ContextualProfileAnalyzer profileAnalyzer;

    @PostMapping("/detect")
    @Operation(summary = "Detect anomalies",
            description = "Runs every detector over the records and returns deduplicated, prioritized findings with a summary and patterns")
    public ResponseEntity<DetectionReport> detect(@Valid @RequestBody DetectionRequestDto request) {
        List<DataRecord> records = toRecords(request.getRecords());
        log.info("Detect request: records={}", records.size());
        return ResponseEntity.ok(orchestrator.detectAnomalies(records));
    }

    @PostMapping("/profiles")
    @Operation(summary = "Merchant and category profiles",
            description = "Average amount, fraud rate, diversity and risk per merchant and per category")
    public ResponseEntity<ProfileReportDto> profiles(@Valid @RequestBody DetectionRequestDto request) {
        List<DataRecord> records = toRecords(request.getRecords());
        log.info("Profile request: records={}", records.size());
        return ResponseEntity.ok(ProfileReportDto.builder()
                .merchants(profileAnalyzer.analyzeMerchants(records))
                .categories(profileAnalyzer.analyzeCategories(records))
                .build());
    }

    @GetMapping("/detectors")
    @Operation(summary = "List detectors", description = "Names of the registered detectors in execution order")
    public ResponseEntity<List<String>> detectors() {
        return ResponseEntity.ok(orchestrator.getDetectorNames());
    }

    private static List<DataRecord> toRecords(List<Map<String, Object>> rows) {
        return rows.stream()
                .map(row -> {
                    if (row == null) throw new IllegalArgumentException("records must not contain null entries");
                    return DataRecord.of(row);
                })
                .collect(Collectors.toList());
    }
}
