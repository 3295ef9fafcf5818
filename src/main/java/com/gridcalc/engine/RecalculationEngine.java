package com.gridcalc.engine;

import com.gridcalc.api.Address;
import com.gridcalc.api.CellError;
import com.gridcalc.api.EvaluationError;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;
import com.gridcalc.expr.Expr;
import com.gridcalc.util.ErrorRateLimiter;

import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Re-evaluates a scheduled list of cells in order.
 *
 * Each result is stored before the next cell is evaluated, so later cells
 * read the values just written by earlier ones. A failing cell gets the error
 * sentinel and the pass continues with the next cell; nothing a formula
 * throws escapes {@link #recalculate}. Unexpected runtime exceptions are
 * recorded as {@link EvaluationError#INTERNAL}.
 *
 * Single-threaded and non-reentrant.
 */
public final class RecalculationEngine {
    private static final Logger log = LogManager.getLogger(RecalculationEngine.class);

    private final Evaluator evaluator;
    private final ErrorRateLimiter errorLog = new ErrorRateLimiter(log, 1000);

    private long epoch;
    private int lastRecalculatedCount;
    private RecalcListener listener;

    public RecalculationEngine(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    public void setListener(RecalcListener listener) {
        this.listener = listener;
    }

    public RecalcListener listener() {
        return listener;
    }

    /**
     * Runs one pass over {@code order}. Cells without a formula are skipped.
     *
     * @return the number of formula cells evaluated
     */
    public int recalculate(List<Address> order, CellStore store) {
        epoch++;
        final RecalcListener l = this.listener;
        if (l != null)
            l.onRecalcStart(epoch, order.size());

        int evaluated = 0;
        for (int i = 0; i < order.size(); i++) {
            Address a = order.get(i);
            Optional<Expr> formula = store.formulaAt(a);
            if (formula.isEmpty())
                continue;

            Value before = store.resolve(a);
            Value result;
            try {
                result = evaluator.evaluate(formula.get(), store);
            } catch (EvaluationException e) {
                fail(store, a, i, e);
                evaluated++;
                continue;
            } catch (RuntimeException e) {
                fail(store, a, i, new EvaluationException(EvaluationError.INTERNAL,
                        "Unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage(), e));
                evaluated++;
                continue;
            }
            store.storeResult(a, result, null);
            if (l != null)
                l.onCellEvaluated(epoch, i, a, !result.equals(before));
            evaluated++;
        }

        lastRecalculatedCount = evaluated;
        if (l != null)
            l.onRecalcEnd(epoch, evaluated);
        return evaluated;
    }

    private void fail(CellStore store, Address a, int order, EvaluationException e) {
        store.storeResult(a, Value.ERROR, CellError.of(e));
        errorLog.log("Evaluation of " + a + " failed: " + e.getMessage(), e);
        if (listener != null)
            listener.onCellError(epoch, order, a, e);
    }

    public long epoch() {
        return epoch;
    }

    public int lastRecalculatedCount() {
        return lastRecalculatedCount;
    }
}
