package com.forensicalpha.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Coverage report for one assembly run.
 * {@code completenessPercent} is the share of non-null cells over every year seen
 * (before the minimum-signal filter), rounded to one decimal place. {@code minSignals}
 * is the threshold that decided which years were dropped.
 */
public record DataQualitySummary(
    @JsonProperty("years")               List<Integer> years,
    @JsonProperty("survivingYears")      List<Integer> survivingYears,
    @JsonProperty("droppedYears")        List<Integer> droppedYears,
    @JsonProperty("minSignals")          int           minSignals,
    @JsonProperty("metricCount")         int           metricCount,
    @JsonProperty("completenessPercent") double        completenessPercent
) {}
