package com.gridcalc.fn;

import com.gridcalc.api.Value;

import java.util.List;

/** SUM, AVERAGE, MIN, MAX. Range-aware; every member is coerced to a number. */
final class AggregateFunctions {

    private AggregateFunctions() {
    }

    static void register(FunctionRegistry.Builder b) {
        b.atLeast("SUM", 1, args -> Value.number(sum(args.flatten())));
        b.atLeast("AVERAGE", 1, args -> {
            List<Value> values = args.flatten();
            return Value.number(sum(values) / values.size());
        });
        b.atLeast("MIN", 1, args -> {
            double min = Double.POSITIVE_INFINITY;
            for (Value v : args.flatten())
                min = Math.min(min, v.toNumber());
            return Value.number(min);
        });
        b.atLeast("MAX", 1, args -> {
            double max = Double.NEGATIVE_INFINITY;
            for (Value v : args.flatten())
                max = Math.max(max, v.toNumber());
            return Value.number(max);
        });
    }

    private static double sum(List<Value> values) {
        double total = 0.0;
        for (Value v : values)
            total += v.toNumber();
        return total;
    }
}
