package com.gridcalc.engine;

import com.gridcalc.api.Address;
import com.gridcalc.api.EditException;
import com.gridcalc.api.ErrorKind;

import java.util.List;
import java.util.stream.Collectors;

/** The edit would have made a cell depend on itself. */
public class CircularReferenceException extends EditException {
    private final List<Address> cycle;

    public CircularReferenceException(List<Address> cycle) {
        super(ErrorKind.CIRCULAR_REFERENCE, "Circular reference: "
                + cycle.stream().map(Address::toA1).collect(Collectors.joining(" -> ")) + " -> " + cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    /** One address on the cycle (the edited cell). */
    public Address address() {
        return cycle.get(0);
    }

    /** The cycle as a dependency chain, starting at {@link #address()}. */
    public List<Address> cycle() {
        return cycle;
    }
}
