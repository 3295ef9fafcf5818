package com.gridcalc.wiring;

import com.gridcalc.api.Address;

/**
 * Mutable edit carried by the ring buffer.
 *
 * <p>
 * Instances are pre-allocated by the ring buffer and reused for its whole
 * lifetime; producers overwrite one via {@link #setCell} or {@link #clearCell}
 * and the consumer calls {@link #clear()} once the edit has been applied.
 */
public final class EditEvent {

    public enum Kind {
        SET, CLEAR
    }

    private Kind kind;
    private Address address;
    private String raw;
    private long sequenceId;

    public void setCell(Address address, String raw, long seqId) {
        this.kind = Kind.SET;
        this.address = address;
        this.raw = raw;
        this.sequenceId = seqId;
    }

    public void clearCell(Address address, long seqId) {
        this.kind = Kind.CLEAR;
        this.address = address;
        this.raw = null;
        this.sequenceId = seqId;
    }

    public Kind kind() {
        return kind;
    }

    public Address address() {
        return address;
    }

    /** Raw input for {@link Kind#SET}, null for {@link Kind#CLEAR}. */
    public String raw() {
        return raw;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        kind = null;
        address = null;
        raw = null;
        sequenceId = 0;
    }
}
