package com.tokengate.contract;

import com.aerospike.client.AerospikeClient;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.tokengate.config.TestAerospikeConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so operators' tooling (cron callers, dashboards)
 * notices when an endpoint or schema disappears.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@MockBean(AerospikeClient.class)
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

        // Re-verification endpoints
        assertThat(paths).containsKey("/api/v1/reverification/run");
        assertThat(paths).containsKey("/api/v1/reverification/last");

        // Onboarding endpoints
        assertThat(paths).containsKey("/api/v1/onboarding/pending");
        assertThat(paths).containsKey("/api/v1/onboarding/rejections");
        assertThat(paths).containsKey("/api/v1/onboarding/groups/{groupId}");

        // Transport intake
        assertThat(paths).containsKey("/telegram/webhook");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("SweepReport");
        assertThat(schemas).containsKey("GroupConfig");
        assertThat(schemas).containsKey("RejectedGroup");
        assertThat(schemas).containsKey("PendingWhitelistRequest");
        assertThat(schemas).containsKey("GroupOnboardingStatus");
    }

    @Test
    void sweepReportSchema_hasCounters() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> props = json.read("$.components.schemas.SweepReport.properties");

        assertThat(props).containsKeys("trigger", "skipped", "usersChecked", "retained", "evicted", "skippedStale", "errors");
    }

    @Test
    void webhook_wrongSecret_isRejected() {
        ResponseEntity<String> response = restTemplate.postForEntity("/telegram/webhook",
                Map.of("update_id", 1), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    }
}
