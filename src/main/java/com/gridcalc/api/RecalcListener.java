package com.gridcalc.api;

/**
 * Observability hook for recalculation passes.
 *
 * Callbacks run inline on the editing thread, between cell evaluations.
 * Implementations should stay cheap.
 */
public interface RecalcListener {

    /**
     * Called before a recalculation pass begins.
     *
     * @param epoch incrementing pass counter
     * @param cells number of cells scheduled in this pass
     */
    void onRecalcStart(long epoch, int cells);

    /**
     * Called after a cell has been evaluated and its value stored.
     *
     * @param epoch current pass
     * @param order position of the cell in the pass's topological order
     * @param address the evaluated cell
     * @param changed whether the cached value differs from the previous one
     */
    void onCellEvaluated(long epoch, int order, Address address, boolean changed);

    /**
     * Called when a cell's evaluation failed. The cell now holds the error sentinel.
     */
    void onCellError(long epoch, int order, Address address, EvaluationException error);

    /** Called after the pass completes. */
    void onRecalcEnd(long epoch, int cellsEvaluated);
}
