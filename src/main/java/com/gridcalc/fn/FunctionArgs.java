package com.gridcalc.fn;

import com.gridcalc.api.EvaluationError;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.Value;

import java.util.List;

/**
 * Lazily evaluated call arguments.
 *
 * Nothing is evaluated until a function asks for it, which is what lets
 * {@code IF} skip its untaken branch. Each call to {@link #value(int)}
 * evaluates the argument again.
 */
public interface FunctionArgs {

    int size();

    /**
     * Evaluates a single scalar argument.
     *
     * @throws EvaluationException with {@link EvaluationError#RANGE_CONTEXT} if the
     *                             argument is a range
     */
    Value value(int index);

    /** Evaluates every argument, expanding ranges row-major into their member values. */
    List<Value> flatten();

    default double number(int index) {
        return value(index).toNumber();
    }

    default String text(int index) {
        return value(index).toText();
    }

    /**
     * Evaluates an argument used as a count or position. Non-empty text that
     * does not read as a number is a coercion error. Fractions are truncated.
     */
    default int integer(int index) {
        Value v = value(index);
        if (!v.isNumeric() && !v.toText().isEmpty())
            throw new EvaluationException(EvaluationError.COERCION,
                    "Argument " + (index + 1) + " is not a number: \"" + v.toText() + "\"");
        double d = v.toNumber();
        if (Double.isNaN(d) || Double.isInfinite(d))
            throw new EvaluationException(EvaluationError.COERCION, "Argument " + (index + 1) + " is not finite");
        return (int) d;
    }
}
