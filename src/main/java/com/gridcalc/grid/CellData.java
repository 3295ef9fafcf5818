package com.gridcalc.grid;

import com.gridcalc.api.CellError;
import com.gridcalc.api.Value;
import com.gridcalc.expr.Expr;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable contents of one cell: what the user typed, the parsed formula
 * (absent for literals), the cached value and the last evaluation error.
 */
public final class CellData {

    /** State of a cell that has never been written. */
    public static final CellData EMPTY = new CellData(null, null, Value.EMPTY, null);

    private final String rawInput;
    private final Expr formula;
    private final Value value;
    private final CellError lastError;

    public CellData(String rawInput, Expr formula, Value value, CellError lastError) {
        this.rawInput = rawInput;
        this.formula = formula;
        this.value = Objects.requireNonNull(value, "value");
        this.lastError = lastError;
    }

    /** A literal cell; the value is auto-typed from the text. */
    public static CellData literal(String raw) {
        return new CellData(raw, null, Value.fromLiteral(raw), null);
    }

    public Optional<String> rawInput() {
        return Optional.ofNullable(rawInput);
    }

    public Optional<Expr> formula() {
        return Optional.ofNullable(formula);
    }

    public Value value() {
        return value;
    }

    public Optional<CellError> lastError() {
        return Optional.ofNullable(lastError);
    }

    public boolean isFormula() {
        return formula != null;
    }

    public boolean hasError() {
        return lastError != null;
    }

    /** Text shown to users and exported: the error sentinel for failed cells. */
    public String displayValue() {
        return lastError != null ? Value.ERROR_TOKEN : value.toText();
    }

    /** Formula text as typed, or null for literals. */
    public String formulaText() {
        return formula != null || (rawInput != null && rawInput.startsWith("=")) ? rawInput : null;
    }

    CellData withResult(Value newValue, CellError error) {
        return new CellData(rawInput, formula, newValue, error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CellData other))
            return false;
        return Objects.equals(rawInput, other.rawInput)
                && Objects.equals(formula, other.formula)
                && value.equals(other.value)
                && Objects.equals(lastError, other.lastError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawInput, formula, value, lastError);
    }

    @Override
    public String toString() {
        return "CellData{raw=" + rawInput + ", value=" + value + (lastError != null ? ", error=" + lastError : "") + "}";
    }
}
