package com.demographics.anomaly.controller;

import com.demographics.anomaly.model.AnalysisRequest;
import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.DiscrepancyRecord;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.MultivariateOutlierRecord;
import com.demographics.anomaly.service.AnalysisPipelineService;
import com.demographics.anomaly.service.AnalysisResultService;
import com.demographics.anomaly.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.demographics.anomaly.testutil.TestDataFactory.createAnomalyRecord;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AnalysisPipelineService pipelineService;

    @MockBean
    private AnalysisResultService resultService;

    @Test
    void startRun_withoutBody_usesDefaults() throws Exception {
        when(pipelineService.run(any(AnalysisRequest.class))).thenReturn(TestDataFactory.createCompletedRun("RUN-1"));

        mockMvc.perform(post("/api/v1/analysis/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("RUN-1"))
                .andExpect(jsonPath("$.status").value("COMPLETED"));

        verify(pipelineService).run(argThat(r -> r.getYearFrom() == null && r.getIndicators() == null));
    }

    @Test
    void startRun_invertedYears_returnsBadRequest() throws Exception {
        AnalysisRequest request = AnalysisRequest.builder().yearFrom(2020).yearTo(2000).build();

        mockMvc.perform(post("/api/v1/analysis/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("yearFrom"))
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(pipelineService);
    }

    @Test
    void startRun_withIndicators_passesThemOn() throws Exception {
        when(pipelineService.run(any(AnalysisRequest.class))).thenReturn(TestDataFactory.createCompletedRun("RUN-2"));

        mockMvc.perform(post("/api/v1/analysis/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"yearFrom\":1990,\"yearTo\":2000,\"indicators\":[\"BIRTH_RATE\"],\"includeMultivariate\":false}"))
                .andExpect(status().isOk());

        verify(pipelineService).run(argThat(r -> r.getYearFrom() == 1990
                && r.getIndicators().equals(List.of(Indicator.BIRTH_RATE))
                && Boolean.FALSE.equals(r.getIncludeMultivariate())));
    }

    @Test
    void getRun_notFound() throws Exception {
        when(resultService.getRun("MISSING")).thenReturn(null);

        mockMvc.perform(get("/api/v1/analysis/runs/MISSING"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getRuns_success() throws Exception {
        when(resultService.getRuns()).thenReturn(List.of(TestDataFactory.createCompletedRun("RUN-1")));

        mockMvc.perform(get("/api/v1/analysis/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].runId").value("RUN-1"))
                .andExpect(jsonPath("$[0].report").exists());
    }

    @Test
    void getAnomalies_filtersPassedThrough() throws Exception {
        when(resultService.getAnomalies("RUN-1", "NPL", null, Indicator.POPULATION, AnomalyMethod.ACCELERATION))
                .thenReturn(List.of(createAnomalyRecord("RUN-1", "WB", "NPL", 2015, AnomalyMethod.ACCELERATION)));

        mockMvc.perform(get("/api/v1/analysis/runs/RUN-1/anomalies")
                        .param("entityId", "NPL")
                        .param("indicator", "POPULATION")
                        .param("method", "ACCELERATION"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].year").value(2015))
                .andExpect(jsonPath("$[0].methods[0]").value("ACCELERATION"))
                .andExpect(jsonPath("$[0].direction").value("INCREASE"))
                .andExpect(jsonPath("$[0].secondDerivative").value(0.35));
    }

    @Test
    void getAnomalies_unknownRun_notFound() throws Exception {
        when(resultService.getAnomalies(eq("MISSING"), any(), any(), any(), any())).thenReturn(null);

        mockMvc.perform(get("/api/v1/analysis/runs/MISSING/anomalies"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getMultivariate_defaultsToFlaggedOnly() throws Exception {
        when(resultService.getMultivariate("RUN-1", true)).thenReturn(List.of(MultivariateOutlierRecord.builder()
                .runId("RUN-1").entityId("NPL").year(2015).squaredDistance(64.0).distance(8.0)
                .chiSquarePValue(1e-6).flagged(true).featureCount(22).build()));

        mockMvc.perform(get("/api/v1/analysis/runs/RUN-1/multivariate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].distance").value(8.0))
                .andExpect(jsonPath("$[0].flagged").value(true));
    }

    @Test
    void getDiscrepancies_allSlices() throws Exception {
        when(resultService.getDiscrepancies("RUN-1", null, false)).thenReturn(List.of(DiscrepancyRecord.builder()
                .runId("RUN-1").entityId("NPL").indicator(Indicator.POPULATION).year(2010)
                .minValue(1_000_000).maxValue(1_300_000).maxDiscrepancy(0.3).providerCount(2).flagged(true).build()));

        mockMvc.perform(get("/api/v1/analysis/runs/RUN-1/discrepancies").param("flaggedOnly", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].maxDiscrepancy").value(0.3))
                .andExpect(jsonPath("$[0].method").value("DISCREPANCY"));
    }
}
