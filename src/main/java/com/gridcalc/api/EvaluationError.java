package com.gridcalc.api;

/** Reason attached to an {@link ErrorKind#EVALUATION} failure. */
public enum EvaluationError {
    ARITY,
    UNKNOWN_FUNCTION,
    INDEX_OUT_OF_RANGE,
    COERCION,
    DIVISION_BY_ZERO,
    NETWORK,
    DEPTH_EXCEEDED,
    RANGE_CONTEXT,
    /** An unexpected failure inside a function body. */
    INTERNAL
}
