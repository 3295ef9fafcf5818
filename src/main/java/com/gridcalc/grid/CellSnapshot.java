package com.gridcalc.grid;

import com.gridcalc.api.Address;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Verbatim copy of one cell and its precedent set, taken before an edit so
 * the edit can be undone with {@link Grid#restore(CellSnapshot)}.
 *
 * @param existed false if the cell had never been written
 */
public record CellSnapshot(Address address, CellData cell, SortedSet<Address> precedents, boolean existed) {

    public CellSnapshot {
        precedents = Collections.unmodifiableSortedSet(new TreeSet<>(precedents));
    }
}
