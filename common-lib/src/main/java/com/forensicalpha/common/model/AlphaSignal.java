package com.forensicalpha.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative label attached to each year's forensic alpha.
 * {@link #UNAVAILABLE} is used when no alpha could be computed; it is never folded into NEUTRAL.
 */
public enum AlphaSignal {
    STRONG_POSITIVE("Strong Positive"),
    POSITIVE("Positive"),
    NEUTRAL("Neutral"),
    NEGATIVE("Negative"),
    STRONG_NEGATIVE("Strong Negative"),
    UNAVAILABLE("Unavailable");

    private final String label;

    AlphaSignal(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
