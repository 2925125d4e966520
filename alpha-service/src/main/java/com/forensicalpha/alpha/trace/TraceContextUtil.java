package com.forensicalpha.alpha.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;
import java.util.function.Function;

/**
 * Request-scoped trace id for the forensic alpha endpoints.
 *
 * <p>The id comes from the {@value #TRACE_ID_HEADER} header, or is generated when the caller
 * sends none, and travels in the Reactor Context. MDC holds the trace id and the pipeline
 * stage only while a single log statement runs.
 * <pre>
 *     return TraceContextUtil.traced(traceHeader, traceId -&gt; pipeline(request, traceId));
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String STAGE_KEY = "alphaStage";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String UNTRACED = "untraced";

    private TraceContextUtil() {}

    /**
     * Resolves the trace id from {@code headerValue}, builds the pipeline with it and writes
     * it into the pipeline's Reactor Context.
     */
    public static <T> Mono<T> traced(String headerValue, Function<String, Mono<T>> pipeline) {
        String traceId = resolve(headerValue);
        return pipeline.apply(traceId)
            .contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id stored by {@link #traced}, or {@value #UNTRACED} outside a traced pipeline. */
    public static String traceIdOf(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNTRACED);
    }

    /** Uses the caller-supplied id when present, otherwise generates one. */
    public static String resolve(String headerValue) {
        return (headerValue == null || headerValue.isBlank())
            ? UUID.randomUUID().toString()
            : headerValue.trim();
    }

    /** Runs {@code logAction} with {@code traceId} and {@code stage} in MDC, then clears both. */
    public static void logAtStage(String traceId, String stage, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        MDC.put(STAGE_KEY, stage);
        try {
            logAction.run();
        } finally {
            MDC.remove(STAGE_KEY);
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
