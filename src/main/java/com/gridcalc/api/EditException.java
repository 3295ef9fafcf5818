package com.gridcalc.api;

/**
 * Rejection of an edit. When thrown the grid is left exactly as it was before
 * the call.
 */
public class EditException extends Exception {
    private final ErrorKind kind;

    public EditException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
