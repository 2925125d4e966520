package com.forensicalpha.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceLevel {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    ConfidenceLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Case-insensitive lookup; returns {@code null} for anything outside Low / Medium / High. */
    public static ConfidenceLevel fromText(String text) {
        if (text == null) return null;
        for (ConfidenceLevel c : values()) {
            if (c.label.equalsIgnoreCase(text.trim())) return c;
        }
        return null;
    }
}
