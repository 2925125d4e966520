package com.forensicalpha.common.assembler;

import com.forensicalpha.common.exception.ForensicInputException;
import com.forensicalpha.common.model.AssembledRow;
import com.forensicalpha.common.model.AssembledTable;
import com.forensicalpha.common.model.ForensicMetric;
import com.forensicalpha.common.model.RawSignalSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Merges the four forensic score series into one year-by-metric table.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Take the union of year keys across all four series, ascending.</li>
 *   <li>For each year read the four values; a year missing from a series is null.</li>
 *   <li>{@code signalCount} = number of non-null values in the row.</li>
 *   <li>Drop rows with {@code signalCount < minSignals}. Dropped rows are removed, not
 *       null-filled, so they never enter a normalization window downstream.</li>
 * </ol>
 *
 * <p>If no row survives the result is an empty table, not an error.
 * Stateless and thread-safe.
 */
public final class SignalAssembler {

    public static final int DEFAULT_MIN_SIGNALS = 3;
    public static final int MIN_ALLOWED_SIGNALS = 1;
    public static final int MAX_ALLOWED_SIGNALS = ForensicMetric.values().length;

    private SignalAssembler() {}

    /** Assembles with the default threshold of {@value #DEFAULT_MIN_SIGNALS}. */
    public static AssembledTable assemble(RawSignalSeries manipulationRisk,
                                          RawSignalSeries accrualQuality,
                                          RawSignalSeries fundamentalStrength,
                                          RawSignalSeries bankruptcyRisk) {
        return assemble(manipulationRisk, accrualQuality, fundamentalStrength, bankruptcyRisk,
                        DEFAULT_MIN_SIGNALS);
    }

    /**
     * @param minSignals minimum number of non-null values a year needs to survive; must be in [1, 4]
     * @return assembled table; {@link AssembledTable#isEmpty()} signals insufficient data
     * @throws ForensicInputException if a series is null, belongs to the wrong metric,
     *                                or {@code minSignals} is out of range
     */
    public static AssembledTable assemble(RawSignalSeries manipulationRisk,
                                          RawSignalSeries accrualQuality,
                                          RawSignalSeries fundamentalStrength,
                                          RawSignalSeries bankruptcyRisk,
                                          int minSignals) {
        validateMinSignals(minSignals);
        List<RawSignalSeries> series = List.of(
            require(manipulationRisk,    ForensicMetric.MANIPULATION_RISK),
            require(accrualQuality,      ForensicMetric.ACCRUAL_QUALITY),
            require(fundamentalStrength, ForensicMetric.FUNDAMENTAL_STRENGTH),
            require(bankruptcyRisk,      ForensicMetric.BANKRUPTCY_RISK));

        SortedSet<Integer> years = new TreeSet<>();
        for (RawSignalSeries s : series) {
            years.addAll(s.values().keySet());
        }

        List<AssembledRow> rows = new ArrayList<>();
        List<Integer> dropped = new ArrayList<>();
        int presentCells = 0;

        for (int year : years) {
            Double m = manipulationRisk.valueAt(year);
            Double a = accrualQuality.valueAt(year);
            Double f = fundamentalStrength.valueAt(year);
            Double b = bankruptcyRisk.valueAt(year);
            int count = countPresent(m, a, f, b);
            presentCells += count;

            if (count >= minSignals) {
                rows.add(new AssembledRow(year, m, a, f, b, count));
            } else {
                dropped.add(year);
            }
        }

        return new AssembledTable(rows, new ArrayList<>(years), dropped, minSignals, presentCells);
    }

    /**
     * @throws ForensicInputException if {@code minSignals} is outside
     *                                [{@value #MIN_ALLOWED_SIGNALS}, {@value #MAX_ALLOWED_SIGNALS}]
     */
    public static void validateMinSignals(int minSignals) {
        if (minSignals < MIN_ALLOWED_SIGNALS || minSignals > MAX_ALLOWED_SIGNALS) {
            throw new ForensicInputException(
                "minSignals must be between " + MIN_ALLOWED_SIGNALS + " and " + MAX_ALLOWED_SIGNALS
                + " but was " + minSignals);
        }
    }

    private static RawSignalSeries require(RawSignalSeries series, ForensicMetric expected) {
        if (series == null) {
            throw new ForensicInputException(expected.key() + " series must not be null");
        }
        if (series.metric() != expected) {
            throw new ForensicInputException(
                "expected " + expected.key() + " series but got " + series.metric().key());
        }
        return series;
    }

    private static int countPresent(Double... values) {
        int count = 0;
        for (Double v : values) {
            if (v != null) count++;
        }
        return count;
    }
}
