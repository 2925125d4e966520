package com.forensicalpha.alpha.service;

import com.forensicalpha.alpha.dto.ForensicAlphaRequest;
import com.forensicalpha.alpha.dto.ForensicAlphaResponse;
import com.forensicalpha.alpha.logger.AlphaFlowLogger;
import com.forensicalpha.common.assembler.SignalAssembler;
import com.forensicalpha.common.blend.AlphaBlender;
import com.forensicalpha.common.blend.AlphaBlendingConfig;
import com.forensicalpha.common.exception.ForensicInputException;
import com.forensicalpha.common.model.AlphaRecord;
import com.forensicalpha.common.model.AssembledTable;
import com.forensicalpha.common.model.DataQualitySummary;
import com.forensicalpha.common.model.ForensicMetric;
import com.forensicalpha.common.quality.DataQualityInspector;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the forensic alpha pipeline for one request.
 *
 * <p>Synchronous and side-effect free apart from logging; every call recomputes from
 * scratch and nothing is cached between calls. The blending weights are the immutable
 * {@link AlphaBlendingConfig} bean.
 */
@Service
public class ForensicAlphaService {

    private final AlphaBlendingConfig blendingConfig;
    private final AlphaFlowLogger flowLogger;
    private final int defaultMinSignals;

    public ForensicAlphaService(AlphaBlendingConfig blendingConfig,
                                AlphaFlowLogger flowLogger,
                                @Value("${forensic.alpha.min-signals:3}") int defaultMinSignals) {
        SignalAssembler.validateMinSignals(defaultMinSignals);
        this.blendingConfig = blendingConfig;
        this.flowLogger = flowLogger;
        this.defaultMinSignals = defaultMinSignals;
    }

    /**
     * @throws ForensicInputException on a null request, a non-finite score,
     *                                or {@code minSignals} outside [1, 4]
     */
    public ForensicAlphaResponse compute(ForensicAlphaRequest request, String traceId) {
        if (request == null) {
            throw new ForensicInputException("request body must not be empty");
        }
        int minSignals = request.minSignals() != null ? request.minSignals() : defaultMinSignals;

        AssembledTable table = SignalAssembler.assemble(
            request.series(ForensicMetric.MANIPULATION_RISK),
            request.series(ForensicMetric.ACCRUAL_QUALITY),
            request.series(ForensicMetric.FUNDAMENTAL_STRENGTH),
            request.series(ForensicMetric.BANKRUPTCY_RISK),
            minSignals);
        DataQualitySummary quality = DataQualityInspector.inspect(table);
        flowLogger.logAssembly(quality, traceId);

        List<AlphaRecord> records = AlphaBlender.blend(table, blendingConfig);
        flowLogger.logBlend(records, traceId);

        return new ForensicAlphaResponse(traceId, records, quality);
    }
}
