package com.gridcalc.expr;

import com.gridcalc.api.Value;

import java.util.stream.Collectors;

/**
 * Renders an AST back to formula text (without the leading {@code =}).
 * Parentheses are emitted only where precedence or associativity needs them,
 * so printing a parsed formula and parsing it again yields an equal tree.
 */
public final class FormulaPrinter implements ExprVisitor<String> {
    private static final FormulaPrinter INSTANCE = new FormulaPrinter();

    private FormulaPrinter() {
    }

    public static String print(Expr expr) {
        return expr.accept(INSTANCE);
    }

    @Override
    public String visitNumber(Expr.NumberLit n) {
        return Value.formatNumber(n.value());
    }

    @Override
    public String visitString(Expr.StringLit s) {
        return "\"" + s.value().replace("\"", "\"\"") + "\"";
    }

    @Override
    public String visitCellRef(Expr.CellRef ref) {
        return ref.address().toA1();
    }

    @Override
    public String visitRange(Expr.RangeRef range) {
        return range.from().toA1() + ":" + range.to().toA1();
    }

    @Override
    public String visitUnary(Expr.UnaryOp unary) {
        String operand = unary.operand().accept(this);
        if (unary.operand() instanceof Expr.BinaryOp)
            operand = "(" + operand + ")";
        return unary.sign().symbol() + operand;
    }

    @Override
    public String visitBinary(Expr.BinaryOp binary) {
        Expr.Operator op = binary.op();
        String left = binary.left().accept(this);
        String right = binary.right().accept(this);
        if (binary.left() instanceof Expr.BinaryOp l && needsParens(l.op(), op, true))
            left = "(" + left + ")";
        if (binary.right() instanceof Expr.BinaryOp r && needsParens(r.op(), op, false))
            right = "(" + right + ")";
        return left + op.symbol() + right;
    }

    @Override
    public String visitCall(Expr.Call call) {
        return call.name() + "(" + call.args().stream().map(a -> a.accept(this)).collect(Collectors.joining(",")) + ")";
    }

    private static boolean needsParens(Expr.Operator child, Expr.Operator parent, boolean leftSide) {
        if (child.precedence() != parent.precedence())
            return child.precedence() < parent.precedence();
        return leftSide == parent.isRightAssociative();
    }
}
