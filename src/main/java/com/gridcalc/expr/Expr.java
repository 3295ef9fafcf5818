package com.gridcalc.expr;

import com.gridcalc.api.Address;

import java.util.ArrayList;
import java.util.List;

/**
 * Formula AST. Nodes are immutable records; traversal goes through
 * {@link ExprVisitor}.
 */
public interface Expr {

    <R> R accept(ExprVisitor<R> visitor);

    record NumberLit(double value) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> v) {
            return v.visitNumber(this);
        }
    }

    record StringLit(String value) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> v) {
            return v.visitString(this);
        }
    }

    record CellRef(Address address) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> v) {
            return v.visitCellRef(this);
        }
    }

    /** Rectangular range. Corners are kept as written; {@link #addresses()} normalizes them. */
    record RangeRef(Address from, Address to) implements Expr {

        public int top() {
            return Math.min(from.row(), to.row());
        }

        public int bottom() {
            return Math.max(from.row(), to.row());
        }

        public int left() {
            return Math.min(from.col(), to.col());
        }

        public int right() {
            return Math.max(from.col(), to.col());
        }

        /** Number of member cells. */
        public long size() {
            return (long) (bottom() - top() + 1) * (right() - left() + 1);
        }

        /**
         * Member addresses in row-major order.
         *
         * @throws IllegalStateException if the range has more members than a list can hold
         */
        public List<Address> addresses() {
            long size = size();
            if (size > Integer.MAX_VALUE - 8)
                throw new IllegalStateException("Range " + from + ":" + to + " has too many cells: " + size);
            List<Address> out = new ArrayList<>((int) size);
            for (int r = top(); r <= bottom(); r++)
                for (int c = left(); c <= right(); c++)
                    out.add(new Address(r, c));
            return out;
        }

        @Override
        public <R> R accept(ExprVisitor<R> v) {
            return v.visitRange(this);
        }
    }

    record UnaryOp(Sign sign, Expr operand) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> v) {
            return v.visitUnary(this);
        }
    }

    record BinaryOp(Operator op, Expr left, Expr right) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> v) {
            return v.visitBinary(this);
        }
    }

    /** Function call. The name is stored upper-case. */
    record Call(String name, List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> v) {
            return v.visitCall(this);
        }
    }

    enum Sign {
        PLUS("+"), MINUS("-");

        private final String symbol;

        Sign(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /** Binary operators, with binding strength (higher binds tighter). */
    enum Operator {
        EQ("=", 1),
        NE("<>", 1),
        LT("<", 2),
        LE("<=", 2),
        GT(">", 2),
        GE(">=", 2),
        ADD("+", 3),
        SUB("-", 3),
        CONCAT("&", 4),
        MUL("*", 5),
        DIV("/", 5),
        MOD("%", 5),
        POW("**", 6);

        private final String symbol;
        private final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        public boolean isRightAssociative() {
            return this == POW;
        }
    }
}
