package com.gridcalc.fn;

import com.gridcalc.api.EvaluationError;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** ABS, SQRT, ROUND. */
final class NumericFunctions {

    private NumericFunctions() {
    }

    static void register(FunctionRegistry.Builder b) {
        b.exactly("ABS", 1, args -> Value.number(Math.abs(args.number(0))));
        b.exactly("SQRT", 1, args -> {
            double x = args.number(0);
            if (x < 0)
                throw new EvaluationException(EvaluationError.COERCION, "SQRT of negative number " + Value.formatNumber(x));
            return Value.number(Math.sqrt(x));
        });
        b.register("ROUND", 1, 2, args -> {
            double x = args.number(0);
            int places = args.size() > 1 ? args.integer(1) : 0;
            return Value.number(round(x, places));
        });
    }

    /**
     * Beyond this many places either way a double rounds to itself or to zero,
     * so larger counts are clamped here.
     */
    static final int MAX_PLACES = 340;

    /** Half away from zero, as in {@code ROUND(2.5) = 3} and {@code ROUND(-2.5) = -3}. */
    static double round(double x, int places) {
        if (Double.isNaN(x) || Double.isInfinite(x))
            return x;
        int scale = Math.max(-MAX_PLACES, Math.min(MAX_PLACES, places));
        return new BigDecimal(Double.toString(x)).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
