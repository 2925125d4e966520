package com.forensicalpha.common.quality;

import com.forensicalpha.common.model.AssembledTable;
import com.forensicalpha.common.model.DataQualitySummary;
import com.forensicalpha.common.model.ForensicMetric;

/**
 * Summarises coverage of an {@link AssembledTable}.
 *
 * <pre>
 *   completenessPercent = presentCells / (allYears × 4) × 100, one decimal
 * </pre>
 * An input with no years reports 0.0.
 */
public final class DataQualityInspector {

    private DataQualityInspector() {}

    public static DataQualitySummary inspect(AssembledTable table) {
        int metricCount = ForensicMetric.values().length;
        int totalCells = table.allYears().size() * metricCount;
        double completeness = totalCells == 0
            ? 0.0
            : Math.round(table.presentCells() * 1000.0 / totalCells) / 10.0;
        return new DataQualitySummary(
            table.allYears(),
            table.survivingYears(),
            table.droppedYears(),
            table.minSignals(),
            metricCount,
            completeness);
    }
}
