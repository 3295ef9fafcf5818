package com.gridcalc.fn;

import com.gridcalc.api.EvaluationError;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.Value;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FunctionRegistryTest {
    private FunctionRegistry registry;

    @Before
    public void setUp() {
        registry = FunctionRegistry.builtIns(url -> "stub");
    }

    private Value call(String name, Object... args) {
        return registry.lookup(name).orElseThrow().invoke(ValueArgs.of(args));
    }

    @Test
    public void testBuiltInNames() {
        for (String name : List.of("SUM", "AVERAGE", "MIN", "MAX", "ABS", "SQRT", "ROUND", "LEN", "UPPER",
                "LOWER", "TRIM", "LEFT", "RIGHT", "MID", "FIND", "CONCAT", "IF", "AND", "OR", "NOT", "GET"))
            assertTrue(name, registry.contains(name));
        assertEquals(21, registry.size());
    }

    @Test
    public void testLookupIsCaseInsensitive() {
        assertTrue(registry.lookup("sum").isPresent());
        assertEquals("SUM", registry.lookup("Sum").get().name());
        assertFalse(registry.lookup("NOPE").isPresent());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testNamesAreReadOnly() {
        registry.names().add("HACK");
    }

    @Test
    public void testArityIsChecked() {
        try {
            call("ABS", 1, 2);
            fail("Expected EvaluationException");
        } catch (EvaluationException e) {
            assertEquals(EvaluationError.ARITY, e.reason());
            assertEquals("ABS expects exactly 1 argument, got 2", e.getMessage());
        }
        try {
            call("SUM");
            fail("Expected EvaluationException");
        } catch (EvaluationException e) {
            assertEquals(EvaluationError.ARITY, e.reason());
        }
    }

    @Test
    public void testDescribeArity() {
        assertEquals("1 to 2 arguments", registry.lookup("ROUND").get().describeArity());
        assertEquals("at least 1 argument", registry.lookup("CONCAT").get().describeArity());
        assertEquals("exactly 3 arguments", registry.lookup("IF").get().describeArity());
    }

    @Test
    public void testCustomFunctions() {
        FunctionRegistry custom = FunctionRegistry.builder()
                .exactly("DOUBLE", 1, args -> Value.number(args.number(0) * 2))
                .build();
        assertEquals(1, custom.size());
        assertEquals(Value.number(8), custom.lookup("double").get().invoke(ValueArgs.of(4)));
    }

    @Test
    public void testOverrideBuiltIn() {
        FunctionRegistry custom = FunctionRegistry.builtInsBuilder(url -> "")
                .exactly("LEN", 1, args -> Value.number(-1))
                .build();
        assertEquals(21, custom.size());
        assertEquals(Value.number(-1), custom.lookup("LEN").get().invoke(ValueArgs.of("abc")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadArityRegistration() {
        FunctionRegistry.builder().register("BAD", 2, 1, args -> Value.EMPTY);
    }

    @Test
    public void testAggregates() {
        assertEquals(Value.number(6), call("SUM", 1, 2, 3));
        assertEquals(Value.number(2), call("AVERAGE", 1, 2, 3));
        assertEquals(Value.number(-1), call("MIN", 4, -1, 2));
        assertEquals(Value.number(4), call("MAX", 4, -1, 2));
        // text that is not a number counts as 0
        assertEquals(Value.number(3), call("SUM", 3, "abc"));
        assertEquals(Value.number(5), call("SUM", "2", 3));
    }

    @Test
    public void testNumeric() {
        assertEquals(Value.number(3), call("ABS", -3));
        assertEquals(Value.number(4), call("SQRT", 16));
        assertEquals(Value.number(3), call("ROUND", 2.5));
        assertEquals(Value.number(-3), call("ROUND", -2.5));
        assertEquals(Value.number(3.14), call("ROUND", 3.14159, 2));
        assertEquals(Value.number(1200), call("ROUND", 1234, -2));
    }

    @Test
    public void testRoundClampsPlaces() {
        assertEquals(Value.number(0), call("ROUND", 1.5, -3e9));
        assertEquals(Value.number(0), call("ROUND", 1e300, -400));
        assertEquals(Value.number(1.25), call("ROUND", 1.25, 1e9));
        assertEquals(Value.number(1.25), call("ROUND", 1.25, 2147483647));
    }

    @Test
    public void testSqrtOfNegative() {
        try {
            call("SQRT", -1);
            fail("Expected EvaluationException");
        } catch (EvaluationException e) {
            assertEquals(EvaluationError.COERCION, e.reason());
        }
    }

    @Test
    public void testLogical() {
        assertEquals(Value.text("yes"), call("IF", 1, "yes", "no"));
        assertEquals(Value.text("no"), call("IF", "", "yes", "no"));
        assertEquals(Value.ZERO, call("AND", 1, 0));
        assertEquals(Value.ONE, call("AND", 1, "x"));
        assertEquals(Value.ONE, call("OR", 0, 0, 1));
        assertEquals(Value.ZERO, call("OR", 0, ""));
        assertEquals(Value.ONE, call("NOT", 0));
        assertEquals(Value.ZERO, call("NOT", "text"));
    }
}
