package com.forensicalpha.alpha.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forensicalpha.common.model.AdvisorRecommendation;
import com.forensicalpha.common.model.AlphaRecord;
import com.forensicalpha.common.model.ConfidenceLevel;
import com.forensicalpha.common.model.TradeRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * AI advisor: turns a forensic alpha table into a LONG / SHORT / HOLD view using a
 * language model behind an Ollama-compatible {@code /api/generate} endpoint.
 *
 * <p><strong>Request</strong>: {@code {"model", "prompt", "stream": false}} where the prompt is
 * the analyst instructions followed by the alpha records as JSON.
 *
 * <p><strong>Response contract</strong>: the model text must contain one JSON object with
 * {@code recommendation} (LONG/SHORT/HOLD), {@code confidence} (Low/Medium/High) and
 * {@code reasoning}. Text around the object is ignored.
 *
 * <p><strong>Fallback</strong>: when the advisor is disabled, the table is empty, the call
 * fails or times out, or the reply is not well-formed, {@link AdvisorRecommendation#fallback()}
 * is returned. Errors never reach the caller.
 */
@Service
public class AlphaAdvisorService {

    private static final Logger log = LoggerFactory.getLogger(AlphaAdvisorService.class);

    static final String SYSTEM_PROMPT = """
        You are an equity research analyst specializing in forensic accounting.

        You are given:
        - A time series of forensic alpha values
        - Component forensic signals (manipulation risk, accrual quality, fundamental strength, bankruptcy risk)

        Your task:
        1. Recommend ONE of: LONG, SHORT, or HOLD
        2. Provide concise, professional reasoning grounded ONLY in the data
        3. Reference trends, not single-year noise
        4. Avoid speculation or market price discussion
        5. Be cautious and balanced in tone

        Output STRICT JSON with exactly these keys:
        recommendation
        confidence (Low / Medium / High)
        reasoning
        """;

    private final WebClient advisorClient;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final String model;
    private final long timeoutMs;

    public AlphaAdvisorService(WebClient.Builder builder,
                               ObjectMapper objectMapper,
                               @Value("${advisor.enabled:true}") boolean enabled,
                               @Value("${advisor.base-url:http://localhost:11434}") String baseUrl,
                               @Value("${advisor.model:llama3}") String model,
                               @Value("${advisor.timeout-ms:60000}") long timeoutMs) {
        this.advisorClient = builder
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.model = model;
        this.timeoutMs = timeoutMs;
    }

    /**
     * @param records forensic alpha table, ascending by year
     * @return recommendation — never empty, never an error signal
     */
    public Mono<AdvisorRecommendation> evaluate(List<AlphaRecord> records) {
        if (!enabled) {
            log.warn("[AlphaAdvisor] Advisor disabled — returning fallback.");
            return Mono.just(AdvisorRecommendation.fallback());
        }
        if (records == null || records.isEmpty()) {
            log.info("[AlphaAdvisor] No forensic alpha records — returning fallback without calling model.");
            return Mono.just(AdvisorRecommendation.fallback());
        }

        return Mono.fromCallable(() -> buildPrompt(records))
            .flatMap(this::callGenerateApi)
            .map(this::parseResponse)
            .switchIfEmpty(Mono.error(new AdvisorResponseException("Empty advisor response")))
            .doOnSuccess(r -> log.info("[AlphaAdvisor] Recommendation evaluated. recommendation={} confidence={} years={} model={}",
                                       r.recommendation(), r.confidence().label(), records.size(), model))
            .onErrorResume(e -> {
                log.error("[AlphaAdvisor] Advisor call failed — returning fallback. model={} reason={}",
                          model, e.getMessage());
                return Mono.just(AdvisorRecommendation.fallback());
            });
    }

    // ── prompt construction ───────────────────────────────────────────────────

    String buildPrompt(List<AlphaRecord> records) throws Exception {
        return SYSTEM_PROMPT + "\n\nDATA:\n" + objectMapper.writeValueAsString(records);
    }

    // ── model call ────────────────────────────────────────────────────────────

    private Mono<String> callGenerateApi(String prompt) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "prompt", prompt,
            "stream", false
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                advisorClient.post()
                    .uri("/api/generate")
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs))
            )
            .map(response -> {
                try {
                    return objectMapper.readTree(response).path("response").asText("");
                } catch (Exception e) {
                    throw new AdvisorResponseException("Failed to read advisor response envelope", e);
                }
            });
    }

    // ── response parsing ──────────────────────────────────────────────────────

    /**
     * Extracts the outermost {@code {...}} from the model text and validates the three keys.
     *
     * @throws AdvisorResponseException if no JSON object is present, it does not parse,
     *                                  or a key is missing or outside its allowed values
     */
    AdvisorRecommendation parseResponse(String responseText) {
        int start = responseText.indexOf('{');
        int end = responseText.lastIndexOf('}');
        if (start == -1 || end == -1 || end < start) {
            throw new AdvisorResponseException("No JSON object in advisor response");
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(responseText.substring(start, end + 1));
        } catch (Exception e) {
            throw new AdvisorResponseException("Malformed JSON in advisor response", e);
        }

        TradeRecommendation recommendation = TradeRecommendation.fromText(textField(json, "recommendation"));
        ConfidenceLevel confidence = ConfidenceLevel.fromText(textField(json, "confidence"));
        String reasoning = textField(json, "reasoning");

        if (recommendation == null) {
            throw new AdvisorResponseException("Invalid recommendation: " + json.path("recommendation"));
        }
        if (confidence == null) {
            throw new AdvisorResponseException("Invalid confidence: " + json.path("confidence"));
        }
        if (reasoning == null) {
            throw new AdvisorResponseException("Missing reasoning");
        }
        return new AdvisorRecommendation(recommendation, confidence, reasoning, true);
    }

    private static String textField(JsonNode json, String key) {
        JsonNode node = json.get(key);
        return (node == null || node.isNull() || !node.isValueNode()) ? null : node.asText();
    }
}
