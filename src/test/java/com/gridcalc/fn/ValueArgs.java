package com.gridcalc.fn;

import com.gridcalc.api.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Pre-evaluated arguments for calling a function body directly. */
final class ValueArgs implements FunctionArgs {
    private final List<Value> values;

    private ValueArgs(List<Value> values) {
        this.values = values;
    }

    static ValueArgs of(Object... args) {
        List<Value> values = new ArrayList<>(args.length);
        for (Object a : args)
            values.add(a instanceof Number n ? Value.number(n.doubleValue()) : Value.text(String.valueOf(a)));
        return new ValueArgs(values);
    }

    static ValueArgs ofValues(Value... values) {
        return new ValueArgs(Arrays.asList(values));
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public Value value(int index) {
        return values.get(index);
    }

    @Override
    public List<Value> flatten() {
        return values;
    }
}
