package com.forensicalpha.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One year of the assembled table: the four raw scores (nullable) plus the number present.
 */
public record AssembledRow(
    @JsonProperty("year")                int    year,
    @JsonProperty("manipulationRisk")    Double manipulationRisk,
    @JsonProperty("accrualQuality")      Double accrualQuality,
    @JsonProperty("fundamentalStrength") Double fundamentalStrength,
    @JsonProperty("bankruptcyRisk")      Double bankruptcyRisk,
    @JsonProperty("signalCount")         int    signalCount
) {
    @JsonIgnore
    public Double value(ForensicMetric metric) {
        return switch (metric) {
            case MANIPULATION_RISK    -> manipulationRisk;
            case ACCRUAL_QUALITY      -> accrualQuality;
            case FUNDAMENTAL_STRENGTH -> fundamentalStrength;
            case BANKRUPTCY_RISK      -> bankruptcyRisk;
        };
    }
}
