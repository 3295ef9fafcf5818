package com.gridcalc.fn;

import com.gridcalc.api.EvaluationError;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.Value;

import java.util.Locale;

/**
 * String functions. Positions are 0-based and counted in code points.
 */
final class TextFunctions {

    private TextFunctions() {
    }

    static void register(FunctionRegistry.Builder b) {
        b.exactly("LEN", 1, args -> {
            String s = args.text(0);
            return Value.number(s.codePointCount(0, s.length()));
        });
        b.exactly("UPPER", 1, args -> Value.text(args.text(0).toUpperCase(Locale.ROOT)));
        b.exactly("LOWER", 1, args -> Value.text(args.text(0).toLowerCase(Locale.ROOT)));
        b.exactly("TRIM", 1, args -> Value.text(args.text(0).strip()));

        b.exactly("LEFT", 2, args -> {
            String s = args.text(0);
            int count = nonNegative("LEFT", args.integer(1));
            int len = length(s);
            return Value.text(substring(s, 0, Math.min(count, len)));
        });
        b.exactly("RIGHT", 2, args -> {
            String s = args.text(0);
            int count = nonNegative("RIGHT", args.integer(1));
            int len = length(s);
            return Value.text(substring(s, len - Math.min(count, len), len));
        });
        b.exactly("MID", 3, args -> {
            String s = args.text(0);
            int start = nonNegative("MID", args.integer(1));
            int count = nonNegative("MID", args.integer(2));
            int len = length(s);
            if (start > len)
                throw new EvaluationException(EvaluationError.INDEX_OUT_OF_RANGE,
                        "MID start " + start + " is beyond text length " + len);
            return Value.text(substring(s, start, start + Math.min(count, len - start)));
        });
        b.register("FIND", 2, 3, args -> {
            String needle = args.text(0);
            String haystack = args.text(1);
            int from = args.size() > 2 ? nonNegative("FIND", args.integer(2)) : 0;
            int len = length(haystack);
            if (from > len)
                throw new EvaluationException(EvaluationError.INDEX_OUT_OF_RANGE,
                        "FIND start " + from + " is beyond text length " + len);
            int at = haystack.indexOf(needle, haystack.offsetByCodePoints(0, from));
            if (at < 0)
                throw new EvaluationException(EvaluationError.INDEX_OUT_OF_RANGE,
                        "FIND: \"" + needle + "\" not found");
            return Value.number(haystack.codePointCount(0, at));
        });

        b.atLeast("CONCAT", 1, args -> {
            StringBuilder sb = new StringBuilder();
            for (Value v : args.flatten())
                sb.append(v.toText());
            return Value.text(sb.toString());
        });
    }

    private static int nonNegative(String fn, int n) {
        if (n < 0)
            throw new EvaluationException(EvaluationError.INDEX_OUT_OF_RANGE, fn + ": negative position or count " + n);
        return n;
    }

    private static int length(String s) {
        return s.codePointCount(0, s.length());
    }

    // Code point indices, not char indices.
    private static String substring(String s, int from, int to) {
        int begin = s.offsetByCodePoints(0, from);
        int end = s.offsetByCodePoints(begin, to - from);
        return s.substring(begin, end);
    }
}
