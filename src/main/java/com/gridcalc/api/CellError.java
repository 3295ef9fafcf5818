package com.gridcalc.api;

/**
 * Structured error recorded on a cell after a failed evaluation.
 *
 * @param kind    always {@link ErrorKind#EVALUATION} for recalculation failures
 * @param reason  evaluation sub-reason, or null for non-evaluation kinds
 * @param message human-readable diagnostic
 */
public record CellError(ErrorKind kind, EvaluationError reason, String message) {

    public static CellError of(EvaluationException e) {
        return new CellError(ErrorKind.EVALUATION, e.reason(), e.getMessage());
    }

    public static CellError of(ErrorKind kind, String message) {
        return new CellError(kind, null, message);
    }
}
