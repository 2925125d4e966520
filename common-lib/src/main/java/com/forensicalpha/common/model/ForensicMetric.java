package com.forensicalpha.common.model;

/**
 * The four forensic accounting metrics blended into forensic alpha.
 *
 * <p>Polarity is a static property of the metric and is never inferred from data:
 * <pre>
 *   MANIPULATION_RISK    (Beneish M-Score)   higher = worse
 *   ACCRUAL_QUALITY      (Sloan accruals)    higher = worse
 *   FUNDAMENTAL_STRENGTH (Piotroski F-Score) higher = better
 *   BANKRUPTCY_RISK      (Altman Z-Score)    higher = safer
 * </pre>
 * Declaration order is the column order used throughout the pipeline.
 */
public enum ForensicMetric {
    MANIPULATION_RISK("manipulationRisk", Polarity.HIGHER_IS_WORSE),
    ACCRUAL_QUALITY("accrualQuality", Polarity.HIGHER_IS_WORSE),
    FUNDAMENTAL_STRENGTH("fundamentalStrength", Polarity.HIGHER_IS_BETTER),
    BANKRUPTCY_RISK("bankruptcyRisk", Polarity.HIGHER_IS_BETTER);

    private final String key;
    private final Polarity polarity;

    ForensicMetric(String key, Polarity polarity) {
        this.key = key;
        this.polarity = polarity;
    }

    /** camelCase identifier used in JSON payloads and log lines. */
    public String key() {
        return key;
    }

    public Polarity polarity() {
        return polarity;
    }
}
