package com.forensicalpha.common.model;

import com.forensicalpha.common.exception.ForensicInputException;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One externally computed forensic score series: year → nullable value.
 *
 * <p>A {@code null} value and an absent year both mean "not available for that year".
 * Non-finite values are rejected on construction; {@code NaN} is never a stand-in
 * for a missing value.
 */
public record RawSignalSeries(ForensicMetric metric, SortedMap<Integer, Double> values) {

    public RawSignalSeries {
        if (metric == null) {
            throw new ForensicInputException("metric must not be null");
        }
        TreeMap<Integer, Double> copy = new TreeMap<>();
        if (values != null) {
            for (Map.Entry<Integer, Double> e : values.entrySet()) {
                if (e.getKey() == null) {
                    throw new ForensicInputException("null year key in " + metric.key() + " series");
                }
                Double v = e.getValue();
                if (v != null && !Double.isFinite(v)) {
                    throw new ForensicInputException(
                        "non-finite value " + v + " for " + metric.key() + " in year " + e.getKey());
                }
                copy.put(e.getKey(), v);
            }
        }
        values = Collections.unmodifiableSortedMap(copy);
    }

    /** Builds a series from an unordered map; a {@code null} map yields an empty series. */
    public static RawSignalSeries of(ForensicMetric metric, Map<Integer, Double> values) {
        return new RawSignalSeries(metric, values == null ? null : new TreeMap<>(values));
    }

    public static RawSignalSeries empty(ForensicMetric metric) {
        return new RawSignalSeries(metric, null);
    }

    /** Value for {@code year}, or {@code null} when absent or not computed. */
    public Double valueAt(int year) {
        return values.get(year);
    }
}
