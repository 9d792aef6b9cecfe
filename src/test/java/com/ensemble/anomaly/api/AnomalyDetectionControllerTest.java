package com.ensemble.anomaly.api;

import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.CategoryProfile;
import com.ensemble.anomaly.domain.DetectionMethod;
import com.ensemble.anomaly.domain.DetectionReport;
import com.ensemble.anomaly.domain.DetectionSummary;
import com.ensemble.anomaly.domain.MerchantProfile;
import com.ensemble.anomaly.domain.Severity;
import com.ensemble.anomaly.engine.AnomalyOrchestrator;
import com.ensemble.anomaly.engine.ContextualProfileAnalyzer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for AnomalyDetectionController.
 */
@WebMvcTest(controllers = AnomalyDetectionController.class)
class AnomalyDetectionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AnomalyOrchestrator orchestrator;

    @MockitoBean
    private ContextualProfileAnalyzer profileAnalyzer;

    @Test
    void detectReturnsReport() throws Exception {
        AnomalyFinding finding = AnomalyFinding.builder()
                .recordIndex(1)
                .score(0.92)
                .method(DetectionMethod.FRAUD_CLUSTER)
                .severity(Severity.CRITICAL)
                .context(Map.of("clusterSize", 3))
                .build();
        DetectionReport report = DetectionReport.builder()
                .anomalies(List.of(finding))
                .summary(DetectionSummary.builder()
                        .totalAnomalies(1)
                        .severityDistribution(Map.of("critical", 1L))
                        .methodDistribution(Map.of("fraud_cluster", 1L))
                        .categoryDistribution(Map.of())
                        .detectionRate(0.5)
                        .build())
                .patterns(List.of())
                .build();
        when(orchestrator.detectAnomalies(anyList())).thenReturn(report);

        mockMvc.perform(post("/api/v1/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\":[{\"amount\":10},{\"amount\":\"$5,000\",\"merchant_id\":\"M1\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomalies.length()").value(1))
                .andExpect(jsonPath("$.anomalies[0].recordIndex").value(1))
                .andExpect(jsonPath("$.anomalies[0].method").value("fraud_cluster"))
                .andExpect(jsonPath("$.anomalies[0].severity").value("critical"))
                .andExpect(jsonPath("$.summary.totalAnomalies").value(1))
                .andExpect(jsonPath("$.summary.detectionRate").value(0.5));

        verify(orchestrator).detectAnomalies(argThat(records ->
                records.size() == 2 && "M1".equals(records.get(1).get("merchant_id"))));
    }

    @Test
    void detectWithoutRecordsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.records").exists());
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\": [oops"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void nullRecordEntryIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\":[null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        when(orchestrator.detectAnomalies(anyList())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/anomalies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\":[]}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("boom"));
    }

    @Test
    void profilesReturnsMerchantsAndCategories() throws Exception {
        when(profileAnalyzer.analyzeMerchants(anyList())).thenReturn(List.of(MerchantProfile.builder()
                .merchantId("M1").transactionCount(2).avgAmount(1500).fraudRate(0.5)
                .categoryDiversity(1).geographicDiversity(2).risk(0.65).build()));
        when(profileAnalyzer.analyzeCategories(anyList())).thenReturn(List.of(CategoryProfile.builder()
                .category("jewelry").transactionCount(2).avgAmount(1500).fraudRate(0.5)
                .merchantDiversity(1).geographicDiversity(2).risk(0.7).build()));

        mockMvc.perform(post("/api/v1/anomalies/profiles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\":[{\"merchant_id\":\"M1\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.merchants[0].merchantId").value("M1"))
                .andExpect(jsonPath("$.merchants[0].risk").value(0.65))
                .andExpect(jsonPath("$.categories[0].category").value("jewelry"));
    }

    @Test
    void detectorsListsRegisteredNames() throws Exception {
        when(orchestrator.getDetectorNames()).thenReturn(List.of("IsolationForest", "GraphBased"));

        mockMvc.perform(get("/api/v1/anomalies/detectors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1]").value("GraphBased"));
    }
}
