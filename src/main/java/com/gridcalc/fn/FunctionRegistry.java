package com.gridcalc.fn;

import com.gridcalc.api.EvaluationError;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.Value;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, case-insensitive mapping from function name to implementation.
 *
 * There is no process-wide table: a registry is built explicitly and handed
 * to the evaluator, so tests can substitute their own functions.
 */
public final class FunctionRegistry {

    /** Upper bound for functions taking any number of arguments. */
    public static final int VARIADIC = Integer.MAX_VALUE;

    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(10);

    /** A registered function with its accepted argument count range. */
    public record FunctionEntry(String name, int minArgs, int maxArgs, FormulaFunction body) {

        public Value invoke(FunctionArgs args) {
            int n = args.size();
            if (n < minArgs || n > maxArgs)
                throw new EvaluationException(EvaluationError.ARITY, name + " expects " + describeArity() + ", got " + n);
            return body.apply(args);
        }

        public String describeArity() {
            if (maxArgs == VARIADIC)
                return "at least " + minArgs + " argument" + (minArgs == 1 ? "" : "s");
            if (minArgs == maxArgs)
                return "exactly " + minArgs + " argument" + (minArgs == 1 ? "" : "s");
            return minArgs + " to " + maxArgs + " arguments";
        }
    }

    private final Map<String, FunctionEntry> functions;

    private FunctionRegistry(Map<String, FunctionEntry> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** All built-in functions, with GET backed by the JDK HTTP client. */
    public static FunctionRegistry builtIns() {
        return builtIns(new JdkHttpFetcher(DEFAULT_HTTP_TIMEOUT));
    }

    public static FunctionRegistry builtIns(HttpFetcher fetcher) {
        return builtInsBuilder(fetcher).build();
    }

    /** Built-ins as a starting point for adding or overriding functions. */
    public static Builder builtInsBuilder(HttpFetcher fetcher) {
        Builder b = new Builder();
        AggregateFunctions.register(b);
        NumericFunctions.register(b);
        TextFunctions.register(b);
        LogicalFunctions.register(b);
        WebFunctions.register(b, fetcher);
        return b;
    }

    public Optional<FunctionEntry> lookup(String name) {
        return Optional.ofNullable(functions.get(name.toUpperCase(Locale.ROOT)));
    }

    public boolean contains(String name) {
        return functions.containsKey(name.toUpperCase(Locale.ROOT));
    }

    /** Registered names, upper-case, in registration order. */
    public Set<String> names() {
        return functions.keySet();
    }

    public int size() {
        return functions.size();
    }

    public static final class Builder {
        private final Map<String, FunctionEntry> functions = new LinkedHashMap<>();

        private Builder() {
        }

        /** Registers (or replaces) a function. */
        public Builder register(String name, int minArgs, int maxArgs, FormulaFunction body) {
            if (minArgs < 0 || maxArgs < minArgs)
                throw new IllegalArgumentException("Bad arity for " + name + ": " + minArgs + ".." + maxArgs);
            String key = name.toUpperCase(Locale.ROOT);
            functions.put(key, new FunctionEntry(key, minArgs, maxArgs, body));
            return this;
        }

        public Builder exactly(String name, int args, FormulaFunction body) {
            return register(name, args, args, body);
        }

        public Builder atLeast(String name, int minArgs, FormulaFunction body) {
            return register(name, minArgs, VARIADIC, body);
        }

        public FunctionRegistry build() {
            return new FunctionRegistry(functions);
        }
    }
}
