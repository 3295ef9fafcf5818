package com.gridcalc.api;

/** Supplies the current cached value of a cell during evaluation. */
@FunctionalInterface
public interface CellResolver {

    /** Returns the cached value at the address, {@link Value#EMPTY} for absent cells. */
    Value resolve(Address address);
}
