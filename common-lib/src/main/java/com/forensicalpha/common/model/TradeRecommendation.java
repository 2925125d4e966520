package com.forensicalpha.common.model;

/**
 * Position stance suggested by the advisor from the forensic alpha trend.
 *
 * <ul>
 *   <li>LONG  — forensic picture improving</li>
 *   <li>SHORT — forensic picture deteriorating</li>
 *   <li>HOLD  — no clear trend, or no AI interpretation available</li>
 * </ul>
 */
public enum TradeRecommendation {

    LONG,
    SHORT,
    HOLD;

    /** Case-insensitive lookup; returns {@code null} for anything outside the three values. */
    public static TradeRecommendation fromText(String text) {
        if (text == null) return null;
        for (TradeRecommendation r : values()) {
            if (r.name().equalsIgnoreCase(text.trim())) return r;
        }
        return null;
    }
}
