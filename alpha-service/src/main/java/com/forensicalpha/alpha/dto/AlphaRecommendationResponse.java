package com.forensicalpha.alpha.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forensicalpha.common.model.AdvisorRecommendation;
import com.forensicalpha.common.model.AlphaRecord;
import com.forensicalpha.common.model.DataQualitySummary;

import java.util.List;

public record AlphaRecommendationResponse(
    @JsonProperty("traceId")        String                traceId,
    @JsonProperty("records")        List<AlphaRecord>     records,
    @JsonProperty("dataQuality")    DataQualitySummary    dataQuality,
    @JsonProperty("recommendation") AdvisorRecommendation recommendation
) {
    public static AlphaRecommendationResponse of(ForensicAlphaResponse alpha, AdvisorRecommendation recommendation) {
        return new AlphaRecommendationResponse(alpha.traceId(), alpha.records(), alpha.dataQuality(), recommendation);
    }
}
