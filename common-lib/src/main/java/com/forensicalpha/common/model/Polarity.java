package com.forensicalpha.common.model;

/**
 * Whether a higher raw metric value indicates stronger or weaker financial health.
 */
public enum Polarity {
    HIGHER_IS_BETTER(1.0),
    HIGHER_IS_WORSE(-1.0);

    private final double sign;

    Polarity(double sign) {
        this.sign = sign;
    }

    /** Multiplier applied to a normalized value before blending: +1 or −1. */
    public double sign() {
        return sign;
    }
}
