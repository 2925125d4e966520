package com.forensicalpha.alpha.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forensicalpha.common.model.AdvisorRecommendation;
import com.forensicalpha.common.model.AlphaRecord;
import com.forensicalpha.common.model.AlphaSignal;
import com.forensicalpha.common.model.ConfidenceLevel;
import com.forensicalpha.common.model.TradeRecommendation;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class AlphaAdvisorServiceTest {

    private static final List<AlphaRecord> RECORDS = List.of(
        new AlphaRecord(2020, 0.0, 0.0, 0.0, 0.0, 0.0, 4, AlphaSignal.NEUTRAL),
        new AlphaRecord(2021, -0.7071, -0.7071, 0.7071, 0.7071, -0.1414, 4, AlphaSignal.NEUTRAL));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private HttpServer server;

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    private AlphaAdvisorService serviceReplying(int status, String body) throws IOException {
        return serviceReplying(status, body, 0L, 5000L);
    }

    private AlphaAdvisorService serviceReplying(int status, String body, long delayMs, long timeoutMs) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/generate", exchange -> respond(exchange, status, body, delayMs));
        server.start();
        String baseUrl = "http://localhost:" + server.getAddress().getPort();
        return new AlphaAdvisorService(WebClient.builder(), objectMapper, true, baseUrl, "llama3", timeoutMs);
    }

    private void respond(HttpExchange exchange, int status, String body, long delayMs) throws IOException {
        hits.incrementAndGet();
        lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        // -1 tells HttpServer there is no body; 0 would switch to chunked encoding
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private String envelope(String modelText) throws IOException {
        return objectMapper.writeValueAsString(Map.of("model", "llama3", "response", modelText, "done", true));
    }

    private static void assertFallback(AdvisorRecommendation r) {
        assertThat(r).isEqualTo(AdvisorRecommendation.fallback());
        assertThat(r.recommendation()).isEqualTo(TradeRecommendation.HOLD);
        assertThat(r.confidence()).isEqualTo(ConfidenceLevel.LOW);
        assertThat(r.reasoning()).contains("AI interpretation unavailable");
        assertThat(r.aiGenerated()).isFalse();
    }

    @Test
    void parsesJsonEmbeddedInModelText() throws IOException {
        AlphaAdvisorService service = serviceReplying(200, envelope(
            "Here is my view:\n```json\n{\"recommendation\": \"short\", \"confidence\": \"Medium\", "
            + "\"reasoning\": \"Alpha has declined for two consecutive years.\"}\n```"));

        StepVerifier.create(service.evaluate(RECORDS))
            .assertNext(r -> {
                assertThat(r.recommendation()).isEqualTo(TradeRecommendation.SHORT);
                assertThat(r.confidence()).isEqualTo(ConfidenceLevel.MEDIUM);
                assertThat(r.reasoning()).contains("declined");
                assertThat(r.aiGenerated()).isTrue();
            })
            .verifyComplete();
    }

    @Test
    void sendsModelPromptAndNonStreamingFlag() throws IOException {
        AlphaAdvisorService service = serviceReplying(200, envelope(
            "{\"recommendation\":\"HOLD\",\"confidence\":\"Low\",\"reasoning\":\"Flat.\"}"));

        service.evaluate(RECORDS).block();

        JsonNode sent = objectMapper.readTree(lastBody.get());
        assertThat(sent.path("model").asText()).isEqualTo("llama3");
        assertThat(sent.path("stream").asBoolean(true)).isFalse();
        String prompt = sent.path("prompt").asText();
        assertThat(prompt).startsWith(AlphaAdvisorService.SYSTEM_PROMPT);
        assertThat(prompt).contains("\n\nDATA:\n");
        assertThat(prompt).contains("\"forensicAlpha\":-0.1414");
    }

    @Test
    void fallsBackOnTextWithoutJson() throws IOException {
        AlphaAdvisorService service = serviceReplying(200, envelope("I recommend going long."));
        assertFallback(service.evaluate(RECORDS).block());
    }

    @Test
    void fallsBackOnMalformedJson() throws IOException {
        AlphaAdvisorService service = serviceReplying(200, envelope("{\"recommendation\": LONG, }"));
        assertFallback(service.evaluate(RECORDS).block());
    }

    @Test
    void fallsBackOnMissingKey() throws IOException {
        AlphaAdvisorService service = serviceReplying(200, envelope(
            "{\"recommendation\":\"LONG\",\"confidence\":\"High\"}"));
        assertFallback(service.evaluate(RECORDS).block());
    }

    @Test
    void fallsBackOnValueOutsideContract() throws IOException {
        AlphaAdvisorService service = serviceReplying(200, envelope(
            "{\"recommendation\":\"BUY\",\"confidence\":\"High\",\"reasoning\":\"x\"}"));
        assertFallback(service.evaluate(RECORDS).block());
    }

    @Test
    void fallsBackOnEmptyBody() throws IOException {
        AlphaAdvisorService service = serviceReplying(200, "");

        StepVerifier.create(service.evaluate(RECORDS))
            .assertNext(AlphaAdvisorServiceTest::assertFallback)
            .verifyComplete();
        assertThat(hits.get()).isEqualTo(1);
    }

    @Test
    void fallsBackOnServerError() throws IOException {
        AlphaAdvisorService service = serviceReplying(500, "{\"error\":\"model not loaded\"}");
        assertFallback(service.evaluate(RECORDS).block());
        assertThat(hits.get()).isEqualTo(1);
    }

    @Test
    void fallsBackOnTimeout() throws IOException {
        AlphaAdvisorService service = serviceReplying(200, envelope(
            "{\"recommendation\":\"LONG\",\"confidence\":\"High\",\"reasoning\":\"late\"}"), 1500L, 200L);
        assertFallback(service.evaluate(RECORDS).block());
    }

    @Test
    void fallsBackWhenUnreachable() {
        AlphaAdvisorService service = new AlphaAdvisorService(
            WebClient.builder(), objectMapper, true, "http://localhost:1", "llama3", 2000L);
        assertFallback(service.evaluate(RECORDS).block());
    }

    @Test
    void emptyTableSkipsModelCall() throws IOException {
        AlphaAdvisorService service = serviceReplying(200, envelope(
            "{\"recommendation\":\"LONG\",\"confidence\":\"High\",\"reasoning\":\"x\"}"));

        assertFallback(service.evaluate(List.of()).block());
        assertThat(hits.get()).isZero();
    }

    @Test
    void disabledAdvisorSkipsModelCall() throws IOException {
        serviceReplying(200, envelope("{}"));
        AlphaAdvisorService disabled = new AlphaAdvisorService(
            WebClient.builder(), objectMapper, false,
            "http://localhost:" + server.getAddress().getPort(), "llama3", 2000L);

        assertFallback(disabled.evaluate(RECORDS).block());
        assertThat(hits.get()).isZero();
    }
}
