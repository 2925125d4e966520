package com.forensicalpha.alpha.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forensicalpha.common.model.ForensicMetric;
import com.forensicalpha.common.model.RawSignalSeries;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Inbound payload: the four externally computed score series keyed by year, plus an
 * optional minimum-signal threshold. A missing series is treated as empty; a missing
 * {@code minSignals} falls back to the configured default.
 */
public record ForensicAlphaRequest(
    @JsonProperty("manipulationRisk")    Map<Integer, Double> manipulationRisk,
    @JsonProperty("accrualQuality")      Map<Integer, Double> accrualQuality,
    @JsonProperty("fundamentalStrength") Map<Integer, Double> fundamentalStrength,
    @JsonProperty("bankruptcyRisk")      Map<Integer, Double> bankruptcyRisk,
    @JsonProperty("minSignals")          Integer              minSignals
) {
    public RawSignalSeries series(ForensicMetric metric) {
        return RawSignalSeries.of(metric, values(metric));
    }

    /** Distinct years across every supplied series. */
    public int yearCount() {
        Set<Integer> years = new TreeSet<>();
        for (ForensicMetric metric : ForensicMetric.values()) {
            Map<Integer, Double> values = values(metric);
            if (values != null) {
                years.addAll(values.keySet());
            }
        }
        return years.size();
    }

    /** Number of series present in the payload, empty ones included. */
    public int suppliedSeriesCount() {
        int count = 0;
        for (ForensicMetric metric : ForensicMetric.values()) {
            if (values(metric) != null) count++;
        }
        return count;
    }

    private Map<Integer, Double> values(ForensicMetric metric) {
        return switch (metric) {
            case MANIPULATION_RISK    -> manipulationRisk;
            case ACCRUAL_QUALITY      -> accrualQuality;
            case FUNDAMENTAL_STRENGTH -> fundamentalStrength;
            case BANKRUPTCY_RISK      -> bankruptcyRisk;
        };
    }
}
