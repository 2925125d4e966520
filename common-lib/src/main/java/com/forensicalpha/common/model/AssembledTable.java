package com.forensicalpha.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of {@link com.forensicalpha.common.assembler.SignalAssembler}.
 *
 * <ul>
 *   <li>{@code rows}         — surviving years only, ascending; never null, possibly empty</li>
 *   <li>{@code allYears}     — union of years seen across the four input series, ascending</li>
 *   <li>{@code droppedYears} — years removed for having fewer than {@code minSignals} values</li>
 *   <li>{@code presentCells} — non-null raw values counted before the filter</li>
 * </ul>
 */
public record AssembledTable(
    @JsonProperty("rows")         List<AssembledRow> rows,
    @JsonProperty("allYears")     List<Integer>      allYears,
    @JsonProperty("droppedYears") List<Integer>      droppedYears,
    @JsonProperty("minSignals")   int                minSignals,
    @JsonProperty("presentCells") int                presentCells
) {
    public AssembledTable {
        rows         = List.copyOf(rows);
        allYears     = List.copyOf(allYears);
        droppedYears = List.copyOf(droppedYears);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @JsonIgnore
    public List<Integer> survivingYears() {
        List<Integer> years = new ArrayList<>(rows.size());
        for (AssembledRow row : rows) {
            years.add(row.year());
        }
        return years;
    }

    /** Column for one metric over the surviving rows, in year order; entries may be null. */
    public List<Double> column(ForensicMetric metric) {
        List<Double> column = new ArrayList<>(rows.size());
        for (AssembledRow row : rows) {
            column.add(row.value(metric));
        }
        return column;
    }
}
