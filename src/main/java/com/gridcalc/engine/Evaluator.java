package com.gridcalc.engine;

import com.gridcalc.api.Address;
import com.gridcalc.api.CellResolver;
import com.gridcalc.api.EvaluationError;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.Value;
import com.gridcalc.expr.Expr;
import com.gridcalc.expr.ExprVisitor;
import com.gridcalc.fn.FunctionArgs;
import com.gridcalc.fn.FunctionRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a formula AST against a {@link CellResolver}.
 *
 * The evaluator only reads cached values through the resolver; it never
 * parses or evaluates other cells. Recursion is bounded by {@code maxDepth}.
 */
public final class Evaluator {
    public static final int DEFAULT_MAX_DEPTH = 256;

    private final FunctionRegistry registry;
    private final int maxDepth;

    public Evaluator(FunctionRegistry registry) {
        this(registry, DEFAULT_MAX_DEPTH);
    }

    public Evaluator(FunctionRegistry registry, int maxDepth) {
        if (maxDepth < 1)
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.registry = registry;
        this.maxDepth = maxDepth;
    }

    public FunctionRegistry registry() {
        return registry;
    }

    /**
     * @throws EvaluationException on any evaluation failure
     */
    public Value evaluate(Expr expr, CellResolver resolver) {
        return new Evaluation(resolver).eval(expr);
    }

    /** State of a single evaluation: the resolver and the current depth. */
    private final class Evaluation implements ExprVisitor<Value> {
        private final CellResolver resolver;
        private int depth;

        Evaluation(CellResolver resolver) {
            this.resolver = resolver;
        }

        private Value eval(Expr e) {
            if (++depth > maxDepth)
                throw new EvaluationException(EvaluationError.DEPTH_EXCEEDED,
                        "Formula nesting exceeds " + maxDepth + " levels");
            try {
                return e.accept(this);
            } finally {
                depth--;
            }
        }

        @Override
        public Value visitNumber(Expr.NumberLit n) {
            return Value.number(n.value());
        }

        @Override
        public Value visitString(Expr.StringLit s) {
            return Value.text(s.value());
        }

        @Override
        public Value visitCellRef(Expr.CellRef ref) {
            return resolver.resolve(ref.address());
        }

        @Override
        public Value visitRange(Expr.RangeRef range) {
            throw new EvaluationException(EvaluationError.RANGE_CONTEXT,
                    "Range " + range.from() + ":" + range.to() + " used outside a function argument");
        }

        @Override
        public Value visitUnary(Expr.UnaryOp unary) {
            double x = eval(unary.operand()).toNumber();
            return Value.number(unary.sign() == Expr.Sign.MINUS ? -x : x);
        }

        @Override
        public Value visitBinary(Expr.BinaryOp binary) {
            Value l = eval(binary.left());
            Value r = eval(binary.right());
            return switch (binary.op()) {
                case ADD -> Value.number(l.toNumber() + r.toNumber());
                case SUB -> Value.number(l.toNumber() - r.toNumber());
                case MUL -> Value.number(l.toNumber() * r.toNumber());
                case DIV -> {
                    double d = r.toNumber();
                    if (d == 0.0)
                        throw new EvaluationException(EvaluationError.DIVISION_BY_ZERO, "Division by zero");
                    yield Value.number(l.toNumber() / d);
                }
                case MOD -> {
                    double d = r.toNumber();
                    if (d == 0.0)
                        throw new EvaluationException(EvaluationError.DIVISION_BY_ZERO, "Modulo by zero");
                    yield Value.number(l.toNumber() % d);
                }
                case POW -> Value.number(Math.pow(l.toNumber(), r.toNumber()));
                case CONCAT -> Value.concat(l, r);
                case EQ -> Value.bool(Value.looselyEquals(l, r));
                case NE -> Value.bool(!Value.looselyEquals(l, r));
                case LT -> Value.bool(l.toNumber() < r.toNumber());
                case LE -> Value.bool(l.toNumber() <= r.toNumber());
                case GT -> Value.bool(l.toNumber() > r.toNumber());
                case GE -> Value.bool(l.toNumber() >= r.toNumber());
            };
        }

        @Override
        public Value visitCall(Expr.Call call) {
            FunctionRegistry.FunctionEntry fn = registry.lookup(call.name())
                    .orElseThrow(() -> new EvaluationException(EvaluationError.UNKNOWN_FUNCTION,
                            "Unknown function " + call.name()));
            return fn.invoke(new Args(call.args()));
        }

        private final class Args implements FunctionArgs {
            private final List<Expr> args;

            Args(List<Expr> args) {
                this.args = args;
            }

            @Override
            public int size() {
                return args.size();
            }

            @Override
            public Value value(int index) {
                return eval(args.get(index));
            }

            @Override
            public List<Value> flatten() {
                List<Value> out = new ArrayList<>();
                for (Expr arg : args) {
                    if (arg instanceof Expr.RangeRef range) {
                        for (Address a : range.addresses())
                            out.add(resolver.resolve(a));
                    } else {
                        out.add(eval(arg));
                    }
                }
                return out;
            }
        }
    }
}
