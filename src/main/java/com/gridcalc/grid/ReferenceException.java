package com.gridcalc.grid;

import com.gridcalc.api.Address;
import com.gridcalc.api.EditException;
import com.gridcalc.api.ErrorKind;

/** A cell or range address outside the grid bounds. */
public class ReferenceException extends EditException {
    private final Address address;

    public ReferenceException(Address address, int rows, int cols) {
        super(ErrorKind.REFERENCE, "Reference " + address + " is outside the grid ("
                + rows + " rows x " + cols + " columns)");
        this.address = address;
    }

    public ReferenceException(String reference) {
        super(ErrorKind.REFERENCE, "Invalid cell reference: " + reference);
        this.address = null;
    }

    /** The offending address, or null if the reference could not be parsed at all. */
    public Address address() {
        return address;
    }
}
