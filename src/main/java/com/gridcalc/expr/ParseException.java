package com.gridcalc.expr;

import com.gridcalc.api.EditException;
import com.gridcalc.api.ErrorKind;

/** Malformed formula text. No partial AST is ever produced. */
public class ParseException extends EditException {
    private final int position;

    public ParseException(int position, String message) {
        super(ErrorKind.PARSE, message + " at position " + position);
        this.position = position;
    }

    /** Zero-based character offset of the offending input, relative to the formula body. */
    public int position() {
        return position;
    }
}
