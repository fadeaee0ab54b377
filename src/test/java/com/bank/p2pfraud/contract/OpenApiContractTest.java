package com.bank.p2pfraud.contract;

import com.bank.p2pfraud.config.TestAerospikeConfig;
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
 * Guards the published API surface against accidental drift in paths and
 * payload schemas.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        // Payments
        assertThat(paths).containsKey("/api/v1/payments");
        assertThat(paths).containsKey("/api/v1/payments/{txnId}");
        assertThat(paths).containsKey("/api/v1/payments/sender/{senderId}");
        assertThat(paths).containsKey("/api/v1/payments/velocity/{userId}");

        // Cases
        assertThat(paths).containsKey("/api/v1/cases/investigator/{investigatorId}");
        assertThat(paths).containsKey("/api/v1/cases/unassigned");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/assign");
        assertThat(paths).containsKey("/api/v1/cases/{caseId}/resolve");
        assertThat(paths).containsKey("/api/v1/cases/stats");

        // Administration
        assertThat(paths).containsKey("/api/v1/admin/payments/{txnId}/override");
        assertThat(paths).containsKey("/api/v1/admin/accounts");
        assertThat(paths).containsKey("/api/v1/admin/accounts/pending");
        assertThat(paths).containsKey("/api/v1/admin/accounts/{accountId}/approve");
        assertThat(paths).containsKey("/api/v1/admin/accounts/{accountId}/reject");
        assertThat(paths).containsKey("/api/v1/admin/accounts/{accountId}/balance");

        assertThat(paths).containsKey("/api/v1/config");
        assertThat(paths).containsKey("/api/v1/audit");
        assertThat(paths).containsKey("/api/v1/model");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKeys("PaymentRequest", "PaymentResult", "Transaction",
                "InvestigationCase", "Settings", "VelocitySnapshot", "Account", "BalanceAdjustmentRequest",
                "BalanceAdjustmentResult");
    }

    @Test
    void openApiSpec_paymentSchemas_haveRequiredFields() {
        DocumentContext json = apiDocs();

        Map<String, Object> requestProps = json.read("$.components.schemas.PaymentRequest.properties");
        assertThat(requestProps).containsKeys("senderId", "recipientId", "amount", "failedAttempts", "location");

        Map<String, Object> resultProps = json.read("$.components.schemas.PaymentResult.properties");
        assertThat(resultProps).containsKeys("transactionId", "outcome", "finalScore", "riskFactors",
                "recipientDisplayName");

        Map<String, Object> txnProps = json.read("$.components.schemas.Transaction.properties");
        assertThat(txnProps).containsKeys("txnId", "type", "senderId", "recipientId", "amount", "status", "riskScore");
    }
}
