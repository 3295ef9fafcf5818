package com.gridcalc.expr;

import com.gridcalc.api.Address;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Extracts the precedent set of a formula: every cell reference plus every
 * member of every range.
 */
public final class ReferenceCollector implements ExprVisitor<Void> {
    private final SortedSet<Address> refs = new TreeSet<>();
    private final boolean expandRanges;

    private ReferenceCollector(boolean expandRanges) {
        this.expandRanges = expandRanges;
    }

    public static SortedSet<Address> collect(Expr expr) {
        ReferenceCollector c = new ReferenceCollector(true);
        expr.accept(c);
        return c.refs;
    }

    /**
     * Every single-cell reference plus the two corners of every range, without
     * expanding the ranges. Bounds-check these before calling {@link #collect}.
     */
    public static SortedSet<Address> corners(Expr expr) {
        ReferenceCollector c = new ReferenceCollector(false);
        expr.accept(c);
        return c.refs;
    }

    @Override
    public Void visitNumber(Expr.NumberLit n) {
        return null;
    }

    @Override
    public Void visitString(Expr.StringLit s) {
        return null;
    }

    @Override
    public Void visitCellRef(Expr.CellRef ref) {
        refs.add(ref.address());
        return null;
    }

    @Override
    public Void visitRange(Expr.RangeRef range) {
        if (expandRanges) {
            refs.addAll(range.addresses());
        } else {
            refs.add(range.from());
            refs.add(range.to());
        }
        return null;
    }

    @Override
    public Void visitUnary(Expr.UnaryOp unary) {
        unary.operand().accept(this);
        return null;
    }

    @Override
    public Void visitBinary(Expr.BinaryOp binary) {
        binary.left().accept(this);
        binary.right().accept(this);
        return null;
    }

    @Override
    public Void visitCall(Expr.Call call) {
        for (Expr arg : call.args())
            arg.accept(this);
        return null;
    }
}
