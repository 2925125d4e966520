package com.forensicalpha.common.blend;

import com.forensicalpha.common.model.AlphaSignal;

/**
 * Maps a rounded forensic alpha to its qualitative bucket.
 *
 * <pre>
 *   alpha == null   → UNAVAILABLE
 *   alpha &gt;  1.0   → STRONG_POSITIVE
 *   alpha &gt;  0.3   → POSITIVE
 *   alpha &lt; -1.0   → STRONG_NEGATIVE
 *   alpha &lt; -0.3   → NEGATIVE
 *   otherwise       → NEUTRAL
 * </pre>
 * Thresholds are strict: exactly 1.0 is POSITIVE and exactly ±0.3 is NEUTRAL.
 */
public final class AlphaLabeler {

    private static final double STRONG_THRESHOLD = 1.0;
    private static final double THRESHOLD        = 0.3;

    private AlphaLabeler() {}

    public static AlphaSignal label(Double alpha) {
        if (alpha == null) return AlphaSignal.UNAVAILABLE;
        if (alpha >  STRONG_THRESHOLD) return AlphaSignal.STRONG_POSITIVE;
        if (alpha >  THRESHOLD)        return AlphaSignal.POSITIVE;
        if (alpha < -STRONG_THRESHOLD) return AlphaSignal.STRONG_NEGATIVE;
        if (alpha < -THRESHOLD)        return AlphaSignal.NEGATIVE;
        return AlphaSignal.NEUTRAL;
    }
}
