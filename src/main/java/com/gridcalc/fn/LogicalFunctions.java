package com.gridcalc.fn;

import com.gridcalc.api.Value;

/**
 * IF, AND, OR, NOT. Results are 1 for true and 0 for false.
 *
 * IF evaluates its condition and then only the selected branch. AND and OR
 * evaluate every argument.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void register(FunctionRegistry.Builder b) {
        b.exactly("IF", 3, args -> args.value(0).isTruthy() ? args.value(1) : args.value(2));
        b.atLeast("AND", 1, args -> {
            boolean all = true;
            for (Value v : args.flatten())
                all &= v.isTruthy();
            return Value.bool(all);
        });
        b.atLeast("OR", 1, args -> {
            boolean any = false;
            for (Value v : args.flatten())
                any |= v.isTruthy();
            return Value.bool(any);
        });
        b.exactly("NOT", 1, args -> Value.bool(!args.value(0).isTruthy()));
    }
}
