package com.gridcalc.util;

import com.gridcalc.api.Address;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.RecalcListener;

import java.util.Arrays;

/** Fans recalculation callbacks out to several listeners, in registration order. */
public class CompositeRecalcListener implements RecalcListener {
    private RecalcListener[] listeners = new RecalcListener[0];

    public CompositeRecalcListener add(RecalcListener listener) {
        RecalcListener[] old = listeners;
        RecalcListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    /** Removes the first registration of {@code listener}; false if it was not registered. */
    public boolean remove(RecalcListener listener) {
        RecalcListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                RecalcListener[] next = new RecalcListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRecalcStart(long epoch, int cells) {
        for (RecalcListener l : listeners)
            l.onRecalcStart(epoch, cells);
    }

    @Override
    public void onCellEvaluated(long epoch, int order, Address address, boolean changed) {
        for (RecalcListener l : listeners)
            l.onCellEvaluated(epoch, order, address, changed);
    }

    @Override
    public void onCellError(long epoch, int order, Address address, EvaluationException error) {
        for (RecalcListener l : listeners)
            l.onCellError(epoch, order, address, error);
    }

    @Override
    public void onRecalcEnd(long epoch, int cellsEvaluated) {
        for (RecalcListener l : listeners)
            l.onRecalcEnd(epoch, cellsEvaluated);
    }
}
