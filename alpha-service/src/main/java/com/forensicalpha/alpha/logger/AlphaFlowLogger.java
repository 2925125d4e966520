package com.forensicalpha.alpha.logger;

import com.forensicalpha.alpha.dto.ForensicAlphaRequest;
import com.forensicalpha.alpha.trace.TraceContextUtil;
import com.forensicalpha.common.model.AdvisorRecommendation;
import com.forensicalpha.common.model.AlphaRecord;
import com.forensicalpha.common.model.DataQualitySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.List;
import java.util.function.Consumer;

/**
 * Stage logging for one forensic alpha request. Pure side-effects, no business logic.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}   — series accepted by the controller</li>
 *   <li>{@link #SIGNALS_ASSEMBLED}  — year union built and minimum-signal filter applied</li>
 *   <li>{@link #ALPHA_BLENDED}      — normalized, weighted and labelled records produced</li>
 *   <li>{@link #ADVISOR_EVALUATED}  — advisor returned a recommendation (or the fallback)</li>
 * </ol>
 */
@Component
public class AlphaFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AlphaFlowLogger.class);

    public static final String REQUEST_RECEIVED  = "REQUEST_RECEIVED";
    public static final String SIGNALS_ASSEMBLED = "SIGNALS_ASSEMBLED";
    public static final String ALPHA_BLENDED     = "ALPHA_BLENDED";
    public static final String ADVISOR_EVALUATED = "ADVISOR_EVALUATED";

    /** {@code doOnEach} consumer for the inbound request; logs its year and series counts. */
    public Consumer<Signal<ForensicAlphaRequest>> requestReceived() {
        return signal -> {
            ForensicAlphaRequest request = signal.get();
            if (!signal.isOnNext() || request == null) return;
            String traceId = TraceContextUtil.traceIdOf(signal.getContextView());
            TraceContextUtil.logAtStage(traceId, REQUEST_RECEIVED, () ->
                log.info("[AlphaFlow] stage={} years={} seriesSupplied={} minSignals={} traceId={}",
                         REQUEST_RECEIVED, request.yearCount(), request.suppliedSeriesCount(),
                         request.minSignals() != null ? request.minSignals() : "default", traceId)
            );
        };
    }

    /** {@code doOnEach} consumer for the advisor result over {@code years} alpha records. */
    public Consumer<Signal<AdvisorRecommendation>> advisorEvaluated(int years) {
        return signal -> {
            AdvisorRecommendation recommendation = signal.get();
            if (!signal.isOnNext() || recommendation == null) return;
            String traceId = TraceContextUtil.traceIdOf(signal.getContextView());
            TraceContextUtil.logAtStage(traceId, ADVISOR_EVALUATED, () ->
                log.info("[AlphaFlow] stage={} years={} recommendation={} confidence={} aiGenerated={} traceId={}",
                         ADVISOR_EVALUATED, years, recommendation.recommendation(),
                         recommendation.confidence().label(), recommendation.aiGenerated(), traceId)
            );
        };
    }

    public void logAssembly(DataQualitySummary summary, String traceId) {
        TraceContextUtil.logAtStage(traceId, SIGNALS_ASSEMBLED, () ->
            log.info("[AlphaFlow] stage={} years={} surviving={} dropped={} minSignals={} completeness={}% traceId={}",
                     SIGNALS_ASSEMBLED,
                     summary.years().size(), summary.survivingYears().size(),
                     summary.droppedYears(), summary.minSignals(), summary.completenessPercent(), traceId)
        );
    }

    public void logBlend(List<AlphaRecord> records, String traceId) {
        TraceContextUtil.logAtStage(traceId, ALPHA_BLENDED, () -> {
            if (records.isEmpty()) {
                log.info("[AlphaFlow] stage={} records=0 (insufficient data) traceId={}",
                         ALPHA_BLENDED, traceId);
                return;
            }
            AlphaRecord latest = records.get(records.size() - 1);
            log.info("[AlphaFlow] stage={} records={} latestYear={} latestAlpha={} latestSignal={} traceId={}",
                     ALPHA_BLENDED, records.size(), latest.year(), latest.forensicAlpha(),
                     latest.signal().label(), traceId);
        });
    }
}
