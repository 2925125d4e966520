package com.forensicalpha.common.blend;

import com.forensicalpha.common.assembler.SignalAssembler;
import com.forensicalpha.common.model.AlphaRecord;
import com.forensicalpha.common.model.AssembledTable;
import com.forensicalpha.common.model.RawSignalSeries;

import java.util.List;

/**
 * Full pipeline: {@link SignalAssembler} → {@link AlphaBlender}.
 * Pure function of its arguments; every call recomputes from scratch.
 */
public final class ForensicAlphaCalculator {

    private ForensicAlphaCalculator() {}

    public static List<AlphaRecord> compute(RawSignalSeries manipulationRisk,
                                            RawSignalSeries accrualQuality,
                                            RawSignalSeries fundamentalStrength,
                                            RawSignalSeries bankruptcyRisk) {
        return compute(manipulationRisk, accrualQuality, fundamentalStrength, bankruptcyRisk,
                       SignalAssembler.DEFAULT_MIN_SIGNALS, AlphaBlendingConfig.DEFAULT);
    }

    public static List<AlphaRecord> compute(RawSignalSeries manipulationRisk,
                                            RawSignalSeries accrualQuality,
                                            RawSignalSeries fundamentalStrength,
                                            RawSignalSeries bankruptcyRisk,
                                            int minSignals,
                                            AlphaBlendingConfig config) {
        AssembledTable table = SignalAssembler.assemble(
            manipulationRisk, accrualQuality, fundamentalStrength, bankruptcyRisk, minSignals);
        return AlphaBlender.blend(table, config);
    }
}
