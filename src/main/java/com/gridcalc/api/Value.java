package com.gridcalc.api;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Dynamically typed cell value: either a {@code NUMBER} (IEEE double) or a
 * {@code TEXT} (character sequence).
 *
 * There is no null or empty variant. An absent cell reads as {@link #EMPTY},
 * the empty text, which coerces to 0 in numeric context. Consumers switch on
 * {@link #kind()} rather than inspecting the runtime type.
 */
public final class Value {

    public enum Kind {
        NUMBER, TEXT
    }

    /** Display token for a cell whose evaluation failed. */
    public static final String ERROR_TOKEN = "#ERROR";

    public static final Value EMPTY = new Value(Kind.TEXT, 0.0, "");
    public static final Value ZERO = new Value(Kind.NUMBER, 0.0, null);
    public static final Value ONE = new Value(Kind.NUMBER, 1.0, null);
    public static final Value ERROR = new Value(Kind.TEXT, 0.0, ERROR_TOKEN);

    // Plain decimal with optional sign and exponent. No NaN/Infinity spellings, no padding.
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final Kind kind;
    private final double number;
    private final String text;

    private Value(Kind kind, double number, String text) {
        this.kind = kind;
        this.number = number;
        this.text = text;
    }

    public static Value number(double n) {
        if (n == 0.0 && Double.doubleToRawLongBits(n) == 0L)
            return ZERO;
        if (n == 1.0)
            return ONE;
        return new Value(Kind.NUMBER, n, null);
    }

    public static Value text(String s) {
        Objects.requireNonNull(s, "text");
        return s.isEmpty() ? EMPTY : new Value(Kind.TEXT, 0.0, s);
    }

    public static Value bool(boolean b) {
        return b ? ONE : ZERO;
    }

    /** Auto-types raw literal input: a plain decimal becomes a number, anything else text. */
    public static Value fromLiteral(String raw) {
        String trimmed = raw.trim();
        if (!trimmed.isEmpty() && NUMBER.matcher(trimmed).matches())
            return number(Double.parseDouble(trimmed));
        return text(raw);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    /** True for numbers and for text that reads as a plain decimal. */
    public boolean isNumeric() {
        return kind == Kind.NUMBER || NUMBER.matcher(text).matches();
    }

    public double toNumber() {
        return switch (kind) {
            case NUMBER -> number;
            case TEXT -> NUMBER.matcher(text).matches() ? Double.parseDouble(text) : 0.0;
        };
    }

    public String toText() {
        return switch (kind) {
            case NUMBER -> formatNumber(number);
            case TEXT -> text;
        };
    }

    public boolean isTruthy() {
        return switch (kind) {
            case NUMBER -> number != 0.0;
            case TEXT -> !text.isEmpty();
        };
    }

    /** Equality used by {@code =} and {@code <>}. */
    public static boolean looselyEquals(Value a, Value b) {
        if (a.kind == b.kind) {
            return switch (a.kind) {
                case NUMBER -> a.number == b.number;
                case TEXT -> a.text.equals(b.text);
            };
        }
        return a.toText().equals(b.toText());
    }

    /** Ordering used by {@code < > <= >=}; always numeric. */
    public static int compareNumeric(Value a, Value b) {
        return Double.compare(a.toNumber(), b.toNumber());
    }

    public static Value concat(Value a, Value b) {
        return text(a.toText() + b.toText());
    }

    /**
     * Canonical rendering: integral values have no decimal point ({@code 5},
     * {@code 2000000000000}), others use the shortest round-trip digits.
     */
    public static String formatNumber(double n) {
        if (Double.isNaN(n))
            return "NaN";
        if (Double.isInfinite(n))
            return n > 0 ? "inf" : "-inf";
        if (n == 0.0)
            return "0";
        return new BigDecimal(Double.toString(n)).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Value other) || kind != other.kind)
            return false;
        return kind == Kind.NUMBER
                ? Double.compare(number, other.number) == 0
                : text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return kind == Kind.NUMBER ? Double.hashCode(number) : text.hashCode();
    }

    @Override
    public String toString() {
        return kind == Kind.NUMBER ? "Number(" + toText() + ")" : "Text(\"" + text + "\")";
    }
}
