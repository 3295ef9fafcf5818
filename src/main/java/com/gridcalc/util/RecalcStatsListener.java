package com.gridcalc.util;

import com.gridcalc.api.Address;
import com.gridcalc.api.EvaluationError;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.RecalcListener;

import java.util.EnumMap;
import java.util.Map;

import lombok.Getter;

/**
 * Counts recalculation work: passes, cells evaluated, value changes and
 * errors by reason, plus pass latency.
 */
@Getter
public final class RecalcStatsListener implements RecalcListener {
    private long totalPasses;
    private long totalCellsEvaluated;
    private long totalChanged;
    private long totalErrors;
    private int lastCellsEvaluated;
    private long lastLatencyNanos;
    private long maxLatencyNanos;

    @Getter(lombok.AccessLevel.NONE)
    private long passStartNanos;
    @Getter(lombok.AccessLevel.NONE)
    private final Map<EvaluationError, Long> errorsByReason = new EnumMap<>(EvaluationError.class);

    @Override
    public void onRecalcStart(long epoch, int cells) {
        passStartNanos = System.nanoTime();
    }

    @Override
    public void onCellEvaluated(long epoch, int order, Address address, boolean changed) {
        if (changed)
            totalChanged++;
    }

    @Override
    public void onCellError(long epoch, int order, Address address, EvaluationException error) {
        totalErrors++;
        errorsByReason.merge(error.reason(), 1L, Long::sum);
    }

    @Override
    public void onRecalcEnd(long epoch, int cellsEvaluated) {
        lastLatencyNanos = System.nanoTime() - passStartNanos;
        maxLatencyNanos = Math.max(maxLatencyNanos, lastLatencyNanos);
        lastCellsEvaluated = cellsEvaluated;
        totalCellsEvaluated += cellsEvaluated;
        totalPasses++;
    }

    public long errors(EvaluationError reason) {
        return errorsByReason.getOrDefault(reason, 0L);
    }

    public void reset() {
        totalPasses = 0;
        totalCellsEvaluated = 0;
        totalChanged = 0;
        totalErrors = 0;
        lastCellsEvaluated = 0;
        lastLatencyNanos = 0;
        maxLatencyNanos = 0;
        errorsByReason.clear();
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-22s | %10s%n", "Metric", "Value"));
        sb.append("-----------------------------------\n");
        sb.append(String.format("%-22s | %10d%n", "Passes", totalPasses));
        sb.append(String.format("%-22s | %10d%n", "Cells evaluated", totalCellsEvaluated));
        sb.append(String.format("%-22s | %10d%n", "Values changed", totalChanged));
        sb.append(String.format("%-22s | %10d%n", "Errors", totalErrors));
        for (Map.Entry<EvaluationError, Long> e : errorsByReason.entrySet())
            sb.append(String.format("  %-20s | %10d%n", e.getKey(), e.getValue()));
        sb.append(String.format("%-22s | %10.2f%n", "Max pass latency (us)", maxLatencyNanos / 1000.0));
        return sb.toString();
    }
}
