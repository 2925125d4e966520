package com.forensicalpha.alpha.controller;

import com.forensicalpha.alpha.ai.AlphaAdvisorService;
import com.forensicalpha.alpha.dto.AlphaRecommendationResponse;
import com.forensicalpha.alpha.dto.ErrorResponse;
import com.forensicalpha.alpha.dto.ForensicAlphaRequest;
import com.forensicalpha.alpha.dto.ForensicAlphaResponse;
import com.forensicalpha.alpha.logger.AlphaFlowLogger;
import com.forensicalpha.alpha.service.ForensicAlphaService;
import com.forensicalpha.alpha.trace.TraceContextUtil;
import com.forensicalpha.common.exception.ForensicInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/forensic-alpha")
public class ForensicAlphaController {

    private static final Logger log = LoggerFactory.getLogger(ForensicAlphaController.class);

    private final ForensicAlphaService alphaService;
    private final AlphaAdvisorService advisorService;
    private final AlphaFlowLogger flowLogger;

    public ForensicAlphaController(ForensicAlphaService alphaService,
                                   AlphaAdvisorService advisorService,
                                   AlphaFlowLogger flowLogger) {
        this.alphaService = alphaService;
        this.advisorService = advisorService;
        this.flowLogger = flowLogger;
    }

    @PostMapping
    public Mono<ResponseEntity<ForensicAlphaResponse>> compute(
            @RequestBody ForensicAlphaRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        return TraceContextUtil.traced(traceHeader, traceId -> Mono.just(request)
            .doOnEach(flowLogger.requestReceived())
            .map(r -> alphaService.compute(r, traceId))
            .map(ResponseEntity::ok));
    }

    @PostMapping("/recommendation")
    public Mono<ResponseEntity<AlphaRecommendationResponse>> recommend(
            @RequestBody ForensicAlphaRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        return TraceContextUtil.traced(traceHeader, traceId -> Mono.just(request)
            .doOnEach(flowLogger.requestReceived())
            .map(r -> alphaService.compute(r, traceId))
            .flatMap(alpha -> advisorService.evaluate(alpha.records())
                .doOnEach(flowLogger.advisorEvaluated(alpha.records().size()))
                .map(recommendation -> AlphaRecommendationResponse.of(alpha, recommendation)))
            .map(ResponseEntity::ok));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(ForensicInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(ForensicInputException e) {
        log.warn("Rejected forensic alpha request. reason={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("INVALID_INPUT", e.getMessage()));
    }
}
