package com.macro.liquidity.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI document served by the running application.
 * Ensures the endpoints and the request schemas consumers depend on are present.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
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
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));
        Map<String, Object> paths = json.read("$.paths");

        assertThat(paths).containsKey("/api/v1/liquidity/analysis");
        assertThat(paths).containsKey("/api/v1/liquidity/config");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("AnalysisRequest");
        assertThat(schemas).containsKey("SeriesPayload");
        assertThat(schemas).containsKey("ObservationPayload");
        assertThat(schemas).containsKey("LongRecord");
    }

    @Test
    void openApiSpec_requestSchemas_haveRequiredFields() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));

        Map<String, Object> requestProps = json.read("$.components.schemas.AnalysisRequest.properties");
        assertThat(requestProps).containsKeys("startDate", "reportDate", "series", "supplements",
                "records", "recordFrequency", "includeTable");

        Map<String, Object> seriesProps = json.read("$.components.schemas.SeriesPayload.properties");
        assertThat(seriesProps).containsKeys("name", "frequency", "lastUpdated", "observations");
    }

    @Test
    void openApiSpec_hasApiInfo() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));

        assertThat(json.read("$.info.title", String.class)).isEqualTo("Liquidity Analytics API");
        assertThat(json.read("$.info.version", String.class)).isEqualTo("1.0.0");
    }

    @Test
    void configEndpoint_reflectsBoundProperties() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/api/v1/liquidity/config", String.class));

        assertThat(json.read("$.stressWeights.sofr_spread", Double.class)).isEqualTo(0.30);
        assertThat(json.read("$.stressWeights.rrp_usage", Double.class)).isEqualTo(0.20);
        assertThat(json.read("$.dailyFillLimitDays", Integer.class)).isEqualTo(3);
    }
}
