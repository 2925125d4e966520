package com.forensicalpha.alpha.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forensicalpha.common.model.AlphaRecord;
import com.forensicalpha.common.model.DataQualitySummary;

import java.util.List;

/** An empty {@code records} list is the valid "insufficient data" answer. */
public record ForensicAlphaResponse(
    @JsonProperty("traceId")     String             traceId,
    @JsonProperty("records")     List<AlphaRecord>  records,
    @JsonProperty("dataQuality") DataQualitySummary dataQuality
) {}
