package com.forensicalpha.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Narrative recommendation produced by the AI advisor from a forensic alpha table.
 *
 * <p>{@link #fallback()} is the fixed conservative answer returned whenever the model
 * cannot be reached or its output is not well-formed: HOLD, Low confidence, and a note
 * that AI interpretation was unavailable. {@code aiGenerated} is false only for that case.
 */
public record AdvisorRecommendation(
    @JsonProperty("recommendation") TradeRecommendation recommendation,
    @JsonProperty("confidence")     ConfidenceLevel     confidence,
    @JsonProperty("reasoning")      String              reasoning,
    @JsonProperty("aiGenerated")    boolean             aiGenerated
) {
    public static final String FALLBACK_REASONING =
        "AI interpretation unavailable. Recommendation based solely on quantitative forensic alpha.";

    public static AdvisorRecommendation fallback() {
        return new AdvisorRecommendation(TradeRecommendation.HOLD, ConfidenceLevel.LOW, FALLBACK_REASONING, false);
    }
}
