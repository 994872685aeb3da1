package com.judgmentbell.orchestrator.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.codec.TrialIdentifierCodec;
import com.judgmentbell.common.design.DesignGenerator;
import com.judgmentbell.common.design.JsonScenarioCatalog;
import com.judgmentbell.common.format.JsonSupport;
import com.judgmentbell.common.verdict.VerdictExtractor;
import com.judgmentbell.orchestrator.logger.ExperimentFlowLogger;
import com.judgmentbell.orchestrator.oracle.RuleBasedOracle;
import com.judgmentbell.orchestrator.service.ExperimentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.InputStream;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() throws Exception {
        ObjectMapper mapper = JsonSupport.newObjectMapper();
        DesignGenerator generator;
        try (InputStream in = getClass().getResourceAsStream("/catalog/scenarios.json")) {
            generator = new DesignGenerator(JsonScenarioCatalog.load(in, mapper), new TrialIdentifierCodec());
        }
        ExperimentService service = new ExperimentService(generator, new RuleBasedOracle(mapper),
            new VerdictExtractor(mapper), new ExperimentFlowLogger(), 10, 5_000, 256);
        client = WebTestClient.bindToController(new ExperimentController(service))
            .controllerAdvice(new ExperimentExceptionHandler())
            .build();
    }

    @SuppressWarnings("unchecked")
    private String designRun() {
        Map<String, Object> body = client.post().uri("/api/v1/experiments/design")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"trials\": 2, \"scenarios\": [\"mutual_betrayal\"], \"languages\": [\"en\"]}")
            .exchange()
            .expectStatus().isCreated()
            .expectBody(Map.class)
            .returnResult().getResponseBody();
        assertNotNull(body);
        assertEquals(16, body.get("requests"));
        assertEquals("DESIGNED", body.get("status"));
        return (String) body.get("runId");
    }

    @Test
    @DisplayName("design → submit → await → COLLECTED with every request resolved")
    void fullLifecycle() {
        String runId = designRun();

        client.post().uri("/api/v1/experiments/{runId}/submit", runId)
            .exchange()
            .expectStatus().isAccepted()
            .expectBody()
            .jsonPath("$.batch.requestCount").isEqualTo(16)
            .jsonPath("$.status").isEqualTo("SUBMITTED");

        client.post().uri("/api/v1/experiments/{runId}/await", runId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.source").isEqualTo("rule-based")
            .jsonPath("$.resolved").isEqualTo(16)
            .jsonPath("$.missing").isEqualTo(0);

        client.get().uri("/api/v1/experiments/{runId}/status", runId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("COLLECTED");
    }

    @Test
    @DisplayName("manifest lists every designed condition")
    void manifest() {
        String runId = designRun();

        client.get().uri("/api/v1/experiments/{runId}/manifest", runId)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.auditHash").exists()
            .jsonPath("$.parameters.trials").isEqualTo(2)
            .jsonPath("$.conditions").isMap();
    }

    @Test
    @DisplayName("unknown run → 404 UNKNOWN_RUN")
    void unknownRun() {
        client.get().uri("/api/v1/experiments/{runId}/status", "run_nope")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.error").isEqualTo("UNKNOWN_RUN");
    }

    @Test
    @DisplayName("second submit → 409 INVALID_STATE")
    void doubleSubmit() {
        String runId = designRun();
        client.post().uri("/api/v1/experiments/{runId}/submit", runId).exchange().expectStatus().isAccepted();

        client.post().uri("/api/v1/experiments/{runId}/submit", runId)
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.error").isEqualTo("INVALID_STATE");
    }

    @Test
    @DisplayName("health reports the active oracle")
    void health() {
        client.get().uri("/api/v1/experiments/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("OK")
            .jsonPath("$.oracle").isEqualTo("rule-based");
    }
}
