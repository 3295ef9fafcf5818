package com.gridcalc.fn;

import com.gridcalc.api.Value;

/**
 * Body of a built-in function. Arity has already been checked when this is
 * called. Failures are reported by throwing
 * {@link com.gridcalc.api.EvaluationException}.
 */
@FunctionalInterface
public interface FormulaFunction {

    Value apply(FunctionArgs args);
}
