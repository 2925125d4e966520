package com.forensicalpha.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One year of blended output.
 *
 * <p>The four {@code *Signal} fields hold direction-corrected expanding-window z-scores
 * (null where the raw score was missing). {@code forensicAlpha} is rounded to four
 * decimal places and is null only when no weight could be applied, in which case
 * {@code signal} is {@link AlphaSignal#UNAVAILABLE}.
 */
public record AlphaRecord(
    @JsonProperty("year")                      int         year,
    @JsonProperty("manipulationRiskSignal")    Double      manipulationRiskSignal,
    @JsonProperty("accrualQualitySignal")      Double      accrualQualitySignal,
    @JsonProperty("fundamentalStrengthSignal") Double      fundamentalStrengthSignal,
    @JsonProperty("bankruptcyRiskSignal")      Double      bankruptcyRiskSignal,
    @JsonProperty("forensicAlpha")             Double      forensicAlpha,
    @JsonProperty("signalCount")               int         signalCount,
    @JsonProperty("signal")                    AlphaSignal signal
) {
    @JsonIgnore
    public Double normalizedSignal(ForensicMetric metric) {
        return switch (metric) {
            case MANIPULATION_RISK    -> manipulationRiskSignal;
            case ACCRUAL_QUALITY      -> accrualQualitySignal;
            case FUNDAMENTAL_STRENGTH -> fundamentalStrengthSignal;
            case BANKRUPTCY_RISK      -> bankruptcyRiskSignal;
        };
    }
}
