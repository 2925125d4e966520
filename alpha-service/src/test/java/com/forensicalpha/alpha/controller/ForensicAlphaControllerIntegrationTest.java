package com.forensicalpha.alpha.controller;

import com.forensicalpha.alpha.trace.TraceContextUtil;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "advisor.enabled=false")
@AutoConfigureWebTestClient
class ForensicAlphaControllerIntegrationTest {

    private static final String SCENARIO = """
        {
          "manipulationRisk":    {"2020": -2.2, "2021": -2.0, "2022": -1.8},
          "accrualQuality":      {"2020": 0.02, "2021": 0.03, "2022": 0.05},
          "fundamentalStrength": {"2020": 6,    "2021": 7,    "2022": 8},
          "bankruptcyRisk":      {"2020": 3.0,  "2021": 3.2,  "2022": 2.9}
        }
        """;

    @Autowired
    private WebTestClient client;

    @Test
    void computesAlphaTable() {
        client.post().uri("/api/v1/forensic-alpha")
            .contentType(MediaType.APPLICATION_JSON)
            .header(TraceContextUtil.TRACE_ID_HEADER, "it-trace")
            .bodyValue(SCENARIO)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.traceId").isEqualTo("it-trace")
            .jsonPath("$.records.length()").isEqualTo(3)
            .jsonPath("$.records[0].year").isEqualTo(2020)
            .jsonPath("$.records[0].signalCount").isEqualTo(4)
            .jsonPath("$.records[1].forensicAlpha").isEqualTo(-0.1414)
            .jsonPath("$.records[2].forensicAlpha").isEqualTo(-0.5037)
            .jsonPath("$.records[2].signal").isEqualTo("Negative")
            .jsonPath("$.dataQuality.completenessPercent").isEqualTo(100.0);
    }

    @Test
    void insufficientDataIsAnEmptyTable() {
        client.post().uri("/api/v1/forensic-alpha")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"manipulationRisk\": {\"2020\": 1.0}, \"accrualQuality\": {\"2020\": null}}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.records.length()").isEqualTo(0)
            .jsonPath("$.dataQuality.droppedYears[0]").isEqualTo(2020);
    }

    @Test
    void rejectsOutOfRangeMinSignals() {
        client.post().uri("/api/v1/forensic-alpha")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"minSignals\": 7}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("INVALID_INPUT");
    }

    @Test
    void recommendationFallsBackWhenAdvisorDisabled() {
        client.post().uri("/api/v1/forensic-alpha/recommendation")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(SCENARIO)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.records.length()").isEqualTo(3)
            .jsonPath("$.recommendation.recommendation").isEqualTo("HOLD")
            .jsonPath("$.recommendation.confidence").isEqualTo("Low")
            .jsonPath("$.recommendation.aiGenerated").isEqualTo(false);
    }

    @Test
    void health() {
        client.get().uri("/api/v1/forensic-alpha/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
