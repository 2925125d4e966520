package com.forensicalpha.common.blend;

import com.forensicalpha.common.exception.ForensicInputException;
import com.forensicalpha.common.model.ForensicMetric;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable weight table passed into {@link AlphaBlender}.
 *
 * <p>Default weights:
 * <pre>
 *   MANIPULATION_RISK    0.35  (negated)
 *   ACCRUAL_QUALITY      0.25  (negated)
 *   FUNDAMENTAL_STRENGTH 0.25
 *   BANKRUPTCY_RISK      0.15
 * </pre>
 * Every metric needs a non-negative weight and the weights must sum to 1.0 (±{@value #SUM_TOLERANCE}).
 * Polarity comes from {@link ForensicMetric#polarity()} and is not configurable.
 */
public final class AlphaBlendingConfig {

    static final double SUM_TOLERANCE = 1e-9;

    public static final AlphaBlendingConfig DEFAULT = new AlphaBlendingConfig(Map.of(
        ForensicMetric.MANIPULATION_RISK,    0.35,
        ForensicMetric.ACCRUAL_QUALITY,      0.25,
        ForensicMetric.FUNDAMENTAL_STRENGTH, 0.25,
        ForensicMetric.BANKRUPTCY_RISK,      0.15
    ));

    private final Map<ForensicMetric, Double> weights;

    public AlphaBlendingConfig(Map<ForensicMetric, Double> weights) {
        if (weights == null) {
            throw new ForensicInputException("weights must not be null");
        }
        EnumMap<ForensicMetric, Double> copy = new EnumMap<>(ForensicMetric.class);
        double sum = 0.0;
        for (ForensicMetric metric : ForensicMetric.values()) {
            Double w = weights.get(metric);
            if (w == null || !Double.isFinite(w) || w < 0.0) {
                throw new ForensicInputException("invalid weight for " + metric.key() + ": " + w);
            }
            copy.put(metric, w);
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ForensicInputException("weights must sum to 1.0 but sum to " + sum);
        }
        this.weights = Collections.unmodifiableMap(copy);
    }

    public double weight(ForensicMetric metric) {
        return weights.get(metric);
    }

    public Map<ForensicMetric, Double> weights() {
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AlphaBlendingConfig other && weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "AlphaBlendingConfig" + weights;
    }
}
