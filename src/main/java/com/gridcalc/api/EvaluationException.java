package com.gridcalc.api;

/**
 * Raised while evaluating a single formula. Caught per cell by the
 * recalculation engine, so it never aborts a pass.
 */
public class EvaluationException extends RuntimeException {
    private final EvaluationError reason;

    public EvaluationException(EvaluationError reason, String message) {
        super(message);
        this.reason = reason;
    }

    public EvaluationException(EvaluationError reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public EvaluationError reason() {
        return reason;
    }

    public ErrorKind kind() {
        return ErrorKind.EVALUATION;
    }
}
