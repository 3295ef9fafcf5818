package com.gridcalc.expr;

import com.gridcalc.api.Address;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves every reference in an AST by a fixed row/column offset, clamping at
 * the first row and column. Used for copy/paste of formulas.
 */
public final class ReferenceShifter implements ExprVisitor<Expr> {
    private final int dRow;
    private final int dCol;

    public ReferenceShifter(int dRow, int dCol) {
        this.dRow = dRow;
        this.dCol = dCol;
    }

    public static Expr shift(Expr expr, int dRow, int dCol) {
        return expr.accept(new ReferenceShifter(dRow, dCol));
    }

    /**
     * Shifts the references of raw cell input. Literals, and formulas that do
     * not parse, are returned unchanged.
     */
    public static String shiftFormula(String raw, int dRow, int dCol) {
        if (raw == null || !raw.startsWith("="))
            return raw;
        try {
            return "=" + FormulaPrinter.print(shift(Parser.parse(raw.substring(1)), dRow, dCol));
        } catch (ParseException e) {
            return raw;
        }
    }

    @Override
    public Expr visitNumber(Expr.NumberLit n) {
        return n;
    }

    @Override
    public Expr visitString(Expr.StringLit s) {
        return s;
    }

    @Override
    public Expr visitCellRef(Expr.CellRef ref) {
        return new Expr.CellRef(ref.address().offset(dRow, dCol));
    }

    @Override
    public Expr visitRange(Expr.RangeRef range) {
        return new Expr.RangeRef(range.from().offset(dRow, dCol), range.to().offset(dRow, dCol));
    }

    @Override
    public Expr visitUnary(Expr.UnaryOp unary) {
        return new Expr.UnaryOp(unary.sign(), unary.operand().accept(this));
    }

    @Override
    public Expr visitBinary(Expr.BinaryOp binary) {
        return new Expr.BinaryOp(binary.op(), binary.left().accept(this), binary.right().accept(this));
    }

    @Override
    public Expr visitCall(Expr.Call call) {
        List<Expr> args = new ArrayList<>(call.args().size());
        for (Expr arg : call.args())
            args.add(arg.accept(this));
        return new Expr.Call(call.name(), args);
    }
}
