package com.gridcalc.engine;

import com.gridcalc.api.Address;
import com.gridcalc.api.CellError;
import com.gridcalc.api.CellResolver;
import com.gridcalc.api.Value;
import com.gridcalc.expr.Expr;

import java.util.Optional;

/** What the recalculation engine needs from the cell store. */
public interface CellStore extends CellResolver {

    /** Parsed formula of the cell, or empty for literals and absent cells. */
    Optional<Expr> formulaAt(Address address);

    /**
     * Stores the result of evaluating the cell's formula.
     *
     * @param error null on success
     */
    void storeResult(Address address, Value value, CellError error);
}
