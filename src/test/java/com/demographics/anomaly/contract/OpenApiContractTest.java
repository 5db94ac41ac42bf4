package com.demographics.anomaly.contract;

import com.demographics.anomaly.DemographicAnomalyApplication;
import com.demographics.anomaly.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published API surface: every endpoint and the record schemas
 * consumers read must stay in the OpenAPI document.
 */
@SpringBootTest(classes = {DemographicAnomalyApplication.class, TestAerospikeConfig.class},
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        assertThat(paths).containsKey("/api/v1/analysis/runs");
        assertThat(paths).containsKey("/api/v1/analysis/runs/{runId}");
        assertThat(paths).containsKey("/api/v1/analysis/runs/{runId}/anomalies");
        assertThat(paths).containsKey("/api/v1/analysis/runs/{runId}/multivariate");
        assertThat(paths).containsKey("/api/v1/analysis/runs/{runId}/discrepancies");

        assertThat(paths).containsKey("/api/v1/credibility/score");
        assertThat(paths).containsKey("/api/v1/credibility/providers");
        assertThat(paths).containsKey("/api/v1/credibility/providers/{providerId}/entities");

        assertThat(paths).containsKey("/api/v1/validation/completeness");
        assertThat(paths).containsKey("/api/v1/validation/sex-balance");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("AnalysisRun");
        assertThat(schemas).containsKey("AnomalyRecord");
        assertThat(schemas).containsKey("MultivariateOutlierRecord");
        assertThat(schemas).containsKey("DiscrepancyRecord");
        assertThat(schemas).containsKey("CredibilityRecord");
        assertThat(schemas).containsKey("OverallCredibilityRecord");
    }

    @Test
    void openApiSpec_anomalyRecordSchema_carriesDiagnostics() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> props = json.read("$.components.schemas.AnomalyRecord.properties");
        assertThat(props).containsKeys("runId", "entityId", "providerId", "indicator", "year", "methods",
                "valueZScore", "yoyChange", "globalZScore", "rollingZScore", "secondDerivative", "direction");
    }
}
