package com.forensicalpha.common.blend;

import com.forensicalpha.common.exception.ForensicInputException;
import com.forensicalpha.common.model.AlphaRecord;
import com.forensicalpha.common.model.AssembledRow;
import com.forensicalpha.common.model.AssembledTable;
import com.forensicalpha.common.model.ForensicMetric;
import com.forensicalpha.common.normalization.NormalizedSignalTable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Blends the normalized, direction-corrected signals into one forensic alpha per year.
 *
 * <h3>Per-year algorithm</h3>
 * <ol>
 *   <li>{@code contribution(m) = weight(m) × signal(m)}; a null signal contributes nothing.</li>
 *   <li>{@code effectiveWeight = Σ weight(m)} over metrics with a non-null signal.</li>
 *   <li>{@code alpha = Σ contribution / effectiveWeight}, rounded to {@value #ALPHA_SCALE}
 *       decimals (half-even).</li>
 *   <li>{@code effectiveWeight == 0} → null alpha, labelled UNAVAILABLE.</li>
 * </ol>
 * Renormalizing by the weights actually present keeps a year with a missing signal on
 * the same scale as a fully populated year.
 *
 * <p>Stateless; the weight table is supplied per call.
 */
public final class AlphaBlender {

    public static final int ALPHA_SCALE = 4;

    private AlphaBlender() {}

    public static List<AlphaRecord> blend(AssembledTable table) {
        return blend(table, AlphaBlendingConfig.DEFAULT);
    }

    /**
     * @param table  output of the signal assembler; an empty table yields an empty list
     * @param config weight table
     * @return one record per surviving year, ascending
     */
    public static List<AlphaRecord> blend(AssembledTable table, AlphaBlendingConfig config) {
        if (table.isEmpty()) {
            return List.of();
        }
        NormalizedSignalTable signals = NormalizedSignalTable.from(table);
        List<AssembledRow> rows = table.rows();
        List<AlphaRecord> records = new ArrayList<>(rows.size());

        for (int i = 0; i < rows.size(); i++) {
            AssembledRow row = rows.get(i);
            Double alpha = composite(signals, i, config);
            records.add(new AlphaRecord(
                row.year(),
                signals.value(ForensicMetric.MANIPULATION_RISK, i),
                signals.value(ForensicMetric.ACCRUAL_QUALITY, i),
                signals.value(ForensicMetric.FUNDAMENTAL_STRENGTH, i),
                signals.value(ForensicMetric.BANKRUPTCY_RISK, i),
                alpha,
                row.signalCount(),
                AlphaLabeler.label(alpha)));
        }
        return List.copyOf(records);
    }

    /** Dynamically renormalized weighted mean of the signals at row {@code index}, rounded; null if no weight applies. */
    static Double composite(NormalizedSignalTable signals, int index, AlphaBlendingConfig config) {
        double weightedSum = 0.0;
        double effectiveWeight = 0.0;
        for (ForensicMetric metric : ForensicMetric.values()) {
            Double signal = signals.value(metric, index);
            if (signal == null) continue;
            double weight = config.weight(metric);
            weightedSum     += weight * signal;
            effectiveWeight += weight;
        }
        if (effectiveWeight == 0.0) {
            return null;
        }
        return round(weightedSum / effectiveWeight);
    }

    /**
     * Half-even rounding to {@value #ALPHA_SCALE} decimals, with −0.0 folded into 0.0.
     *
     * @throws ForensicInputException if {@code value} is NaN or infinite
     */
    public static double round(double value) {
        if (!Double.isFinite(value)) {
            throw new ForensicInputException("forensic alpha is not a finite number: " + value);
        }
        double rounded = BigDecimal.valueOf(value).setScale(ALPHA_SCALE, RoundingMode.HALF_EVEN).doubleValue();
        return rounded == 0.0 ? 0.0 : rounded;
    }
}
