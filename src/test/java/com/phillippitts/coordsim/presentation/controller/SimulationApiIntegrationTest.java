package com.phillippitts.coordsim.presentation.controller;

import com.phillippitts.coordsim.config.StubCollaboratorConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(StubCollaboratorConfiguration.class)
class SimulationApiIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private static Map<String, Object> regulatedRequest() {
        return Map.of(
                "coordinate", Map.of(
                        "pillar", "adaptive",
                        "sector", "healthcare",
                        "role_definition", "executive",
                        "regulatory_framework", "HIPAA",
                        "compliance_level", "strict",
                        "audit_requirements", "comprehensive"),
                "target_personas", List.of("clinician"),
                "regulatory_constraints", Map.of("hipaa", true),
                "analysis_depth", "deep");
    }

    @Test
    @SuppressWarnings("unchecked")
    void createRunAndInspectSession() {
        ResponseEntity<Map> created = restTemplate.postForEntity("/api/session", regulatedRequest(), Map.class);
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(created.getBody()).containsEntry("status", "created");
        String sessionId = (String) created.getBody().get("session_id");
        assertThat(sessionId).isNotBlank();

        ResponseEntity<Map> result = restTemplate.postForEntity(
                "/api/session/" + sessionId + "/simulate", regulatedRequest(), Map.class);
        assertThat(result.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = result.getBody();
        assertThat(body).containsEntry("session_id", sessionId);
        assertThat(body).containsEntry("optimization_applied", true);
        // stage confidence 0.7 raised by one increment
        assertThat((Double) body.get("confidence")).isBetween(0.79, 0.81);
        assertThat((List<String>) body.get("recommendations"))
                .contains("Consider implementing staged rollout due to high complexity");
        assertThat((Map<String, Object>) body.get("regulatory_status")).containsEntry("compliant", true);

        ResponseEntity<Map> status = restTemplate.getForEntity("/api/session/" + sessionId, Map.class);
        assertThat(status.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(status.getBody()).containsEntry("status", "completed");
        assertThat(status.getBody()).containsEntry("progress", 1.0);
        assertThat((List<String>) status.getBody().get("workflow_plan")).containsExactly(
                "coordinate_analysis", "persona_calibration", "simulation_execution",
                "regulatory_validation", "optimization", "synthesis");
    }

    @Test
    void enhancedEndpointRunsInOneCall() {
        ResponseEntity<Map> result = restTemplate.postForEntity(
                "/api/simulate/enhanced", Map.of("coordinate", Map.of("pillar", "foundational", "sector", "retail")),
                Map.class);

        assertThat(result.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(result.getBody()).containsEntry("optimization_applied", true);
        assertThat(result.getBody()).containsKey("performance_metrics");
    }

    @Test
    void unknownSessionReturns404() {
        ResponseEntity<Map> response = restTemplate.getForEntity("/api/session/does-not-exist", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).containsEntry("error_code", "SessionNotFoundException");
    }

    @Test
    void simulateUnknownSessionReturns404() {
        ResponseEntity<Map> response = restTemplate.postForEntity(
                "/api/session/does-not-exist/simulate", regulatedRequest(), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void missingCoordinateReturns400() {
        ResponseEntity<Map> response = restTemplate.postForEntity(
                "/api/session", Map.of("analysis_depth", "deep"), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("error_code", "InvalidRequest");
    }

    @Test
    void blankPillarReturns400() {
        ResponseEntity<Map> response = restTemplate.postForEntity(
                "/api/session", Map.of("coordinate", Map.of("pillar", " ", "sector", "retail")), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void systemMetricsAndCleanupAreAvailable() {
        restTemplate.postForEntity("/api/session", regulatedRequest(), Map.class);

        ResponseEntity<Map> metrics = restTemplate.getForEntity("/metrics/system", Map.class);
        assertThat(metrics.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(metrics.getBody()).containsKeys(
                "total_sessions", "successful_simulations", "failed_simulations",
                "active_sessions", "workflow_efficiency", "timestamp");
        assertThat(((Number) metrics.getBody().get("total_sessions")).longValue()).isPositive();

        ResponseEntity<Map> cleanup = restTemplate.postForEntity("/api/session/cleanup", null, Map.class);
        assertThat(cleanup.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(cleanup.getBody()).containsEntry("removed", 0);
    }

    @Test
    void healthIsUpWithAllCollaborators() {
        ResponseEntity<Map> health = restTemplate.getForEntity("/actuator/health", Map.class);

        assertThat(health.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(health.getBody()).containsEntry("status", "UP");
    }
}
