package com.gridcalc.expr;

public interface ExprVisitor<R> {

    R visitNumber(Expr.NumberLit n);

    R visitString(Expr.StringLit s);

    R visitCellRef(Expr.CellRef ref);

    R visitRange(Expr.RangeRef range);

    R visitUnary(Expr.UnaryOp unary);

    R visitBinary(Expr.BinaryOp binary);

    R visitCall(Expr.Call call);
}
