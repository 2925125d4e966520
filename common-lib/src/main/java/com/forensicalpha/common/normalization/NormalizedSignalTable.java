package com.forensicalpha.common.normalization;

import com.forensicalpha.common.model.AssembledTable;
import com.forensicalpha.common.model.ForensicMetric;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Direction-corrected normalized columns for the surviving years of an {@link AssembledTable}.
 *
 * <p>Each metric is normalized on its own column only. The polarity sign of the metric is
 * applied afterwards, so "higher is better" holds for every column of this table.
 */
public final class NormalizedSignalTable {

    private final Map<ForensicMetric, List<Double>> columns;

    private NormalizedSignalTable(Map<ForensicMetric, List<Double>> columns) {
        this.columns = columns;
    }

    public static NormalizedSignalTable from(AssembledTable table) {
        Map<ForensicMetric, List<Double>> columns = new EnumMap<>(ForensicMetric.class);
        for (ForensicMetric metric : ForensicMetric.values()) {
            List<Double> normalized = ExpandingZScoreNormalizer.normalize(table.column(metric));
            double sign = metric.polarity().sign();
            for (int i = 0; i < normalized.size(); i++) {
                Double z = normalized.get(i);
                if (z == null) continue;
                // keep the convergence value at +0.0 after negation
                normalized.set(i, z == 0.0 ? 0.0 : z * sign);
            }
            columns.put(metric, Collections.unmodifiableList(normalized));
        }
        return new NormalizedSignalTable(Collections.unmodifiableMap(columns));
    }

    /** Direction-corrected value at row {@code index}, or null if the raw score was missing. */
    public Double value(ForensicMetric metric, int index) {
        return columns.get(metric).get(index);
    }
}
