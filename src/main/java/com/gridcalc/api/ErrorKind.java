package com.gridcalc.api;

/** Top-level failure taxonomy of the engine. */
public enum ErrorKind {
    /** Malformed formula text. Rejects the edit. */
    PARSE,
    /** Failure while evaluating a formula. Local to the cell. */
    EVALUATION,
    /** The edit would create a dependency cycle. Rejects the edit. */
    CIRCULAR_REFERENCE,
    /** A cell or range address outside the grid bounds. Rejects the edit. */
    REFERENCE
}
