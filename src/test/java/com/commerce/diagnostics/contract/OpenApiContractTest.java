package com.commerce.diagnostics.contract;

import com.aerospike.client.AerospikeClient;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test over the generated OpenAPI document. Guards the
 * snake_case wire format and the endpoint set used by alerting clients.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @MockBean
    private AerospikeClient aerospikeClient;

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        assertThat(paths).containsKey("/api/v1/analyze");

        assertThat(paths).containsKey("/api/v1/workflows");
        assertThat(paths).containsKey("/api/v1/workflows/run");
        assertThat(paths).containsKey("/api/v1/workflows/{brandId}/{workflowId}");
        assertThat(paths).containsKey("/api/v1/workflows/{brandId}/{workflowId}/versions/{version}/archive");
        assertThat(paths).containsKey("/api/v1/workflows/{brandId}/{workflowId}/executions");
        assertThat(paths).containsKey("/api/v1/workflows/executions/{executionId}");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("Workflow");
        assertThat(schemas).containsKey("WorkflowNode");
        assertThat(schemas).containsKey("WorkflowRunRequest");
        assertThat(schemas).containsKey("AnalyzeRequest");
        assertThat(schemas).containsKey("RunResult");
        assertThat(schemas).containsKey("Finding");
    }

    @Test
    void openApiSpec_usesSnakeCaseProperties() {
        DocumentContext json = apiDocs();

        Map<String, Object> runResult = json.read("$.components.schemas.RunResult.properties");
        assertThat(runResult).containsKeys("status", "classification", "root_causes", "brand_id");

        Map<String, Object> finding = json.read("$.components.schemas.Finding.properties");
        assertThat(finding).containsKeys("dimension", "value", "change", "impact_score");

        Map<String, Object> runRequest = json.read("$.components.schemas.WorkflowRunRequest.properties");
        assertThat(runRequest).containsKeys("brand_id", "workflow_id", "alert_payload");
    }
}
