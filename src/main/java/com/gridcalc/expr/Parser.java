package com.gridcalc.expr;

import com.gridcalc.api.Address;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent formula parser.
 *
 * <pre>
 * expression     ::= equality
 * equality       ::= comparison ( ( "=" | "&lt;&gt;" ) comparison )*
 * comparison     ::= additive ( ( "&lt;" | "&lt;=" | "&gt;" | "&gt;=" ) additive )*
 * additive       ::= concatenation ( ( "+" | "-" ) concatenation )*
 * concatenation  ::= multiplicative ( "&amp;" multiplicative )*
 * multiplicative ::= power ( ( "*" | "/" | "%" ) power )*
 * power          ::= unary ( ( "**" | "^" ) power )?
 * unary          ::= ( "+" | "-" ) unary | primary
 * primary        ::= NUMBER | STRING | CELL_REF ( ":" CELL_REF )?
 *                  | NAME "(" ( expression ( "," expression )* )? ")"
 *                  | "(" expression ")"
 * </pre>
 *
 * Power is right-associative, every other binary level is left-associative.
 * Logical operations ({@code IF}, {@code AND}, ...) are plain calls.
 *
 * Both the parse recursion and the depth of the resulting tree are capped at
 * {@link #MAX_NESTING}, so long operator chains fail with a
 * {@link ParseException} rather than overflowing the stack of a later walk.
 */
public final class Parser {
    /** Maximum syntactic nesting and tree depth; deeper input is rejected instead of overflowing the stack. */
    public static final int MAX_NESTING = 512;

    private final List<Token> tokens;
    private int index;
    private int nesting;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a formula body, i.e. the raw input without its leading {@code =}.
     *
     * @throws ParseException on any lexical or grammatical error
     */
    public static Expr parse(String body) throws ParseException {
        Parser p = new Parser(Lexer.tokenize(body));
        if (p.peek().is(TokenType.EOF))
            throw new ParseException(0, "Empty formula");
        Expr e = p.expression();
        Token trailing = p.peek();
        if (!trailing.is(TokenType.EOF))
            throw new ParseException(trailing.position(), "Unexpected '" + trailing.text() + "'");
        if (depth(e) > MAX_NESTING)
            throw new ParseException(trailing.position(), "Formula nested too deeply");
        return e;
    }

    /** Tree depth of {@code root}, counted without recursion. */
    static int depth(Expr root) {
        Deque<Expr> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);
        int max = 0;
        while (!nodes.isEmpty()) {
            Expr e = nodes.pop();
            int d = depths.pop();
            max = Math.max(max, d);
            if (max > MAX_NESTING)
                return max;
            if (e instanceof Expr.UnaryOp u) {
                nodes.push(u.operand());
                depths.push(d + 1);
            } else if (e instanceof Expr.BinaryOp b) {
                nodes.push(b.left());
                depths.push(d + 1);
                nodes.push(b.right());
                depths.push(d + 1);
            } else if (e instanceof Expr.Call c) {
                for (Expr arg : c.args()) {
                    nodes.push(arg);
                    depths.push(d + 1);
                }
            }
        }
        return max;
    }

    /**
     * Parses raw cell input. Returns empty for literals (no leading {@code =}).
     */
    public static Optional<Expr> parseCellInput(String raw) throws ParseException {
        if (raw == null || !raw.startsWith("="))
            return Optional.empty();
        try {
            return Optional.of(parse(raw.substring(1)));
        } catch (ParseException e) {
            // shift position to account for the leading '='
            throw new ParseException(e.position() + 1, stripPosition(e.getMessage()));
        }
    }

    private Expr expression() throws ParseException {
        return equality();
    }

    private Expr equality() throws ParseException {
        Expr left = comparison();
        while (true) {
            Expr.Operator op = switch (peek().type()) {
                case EQ -> Expr.Operator.EQ;
                case NE -> Expr.Operator.NE;
                default -> null;
            };
            if (op == null)
                return left;
            advance();
            left = new Expr.BinaryOp(op, left, comparison());
        }
    }

    private Expr comparison() throws ParseException {
        Expr left = additive();
        while (true) {
            Expr.Operator op = switch (peek().type()) {
                case LT -> Expr.Operator.LT;
                case LE -> Expr.Operator.LE;
                case GT -> Expr.Operator.GT;
                case GE -> Expr.Operator.GE;
                default -> null;
            };
            if (op == null)
                return left;
            advance();
            left = new Expr.BinaryOp(op, left, additive());
        }
    }

    private Expr additive() throws ParseException {
        Expr left = concatenation();
        while (true) {
            Expr.Operator op = switch (peek().type()) {
                case PLUS -> Expr.Operator.ADD;
                case MINUS -> Expr.Operator.SUB;
                default -> null;
            };
            if (op == null)
                return left;
            advance();
            left = new Expr.BinaryOp(op, left, concatenation());
        }
    }

    private Expr concatenation() throws ParseException {
        Expr left = multiplicative();
        while (peek().is(TokenType.AMPERSAND)) {
            advance();
            left = new Expr.BinaryOp(Expr.Operator.CONCAT, left, multiplicative());
        }
        return left;
    }

    private Expr multiplicative() throws ParseException {
        Expr left = power();
        while (true) {
            Expr.Operator op = switch (peek().type()) {
                case STAR -> Expr.Operator.MUL;
                case SLASH -> Expr.Operator.DIV;
                case PERCENT -> Expr.Operator.MOD;
                default -> null;
            };
            if (op == null)
                return left;
            advance();
            left = new Expr.BinaryOp(op, left, power());
        }
    }

    private Expr power() throws ParseException {
        enter();
        try {
            Expr base = unary();
            if (peek().is(TokenType.POWER)) {
                advance();
                return new Expr.BinaryOp(Expr.Operator.POW, base, power());
            }
            return base;
        } finally {
            nesting--;
        }
    }

    private Expr unary() throws ParseException {
        enter();
        try {
            if (peek().is(TokenType.MINUS)) {
                advance();
                return new Expr.UnaryOp(Expr.Sign.MINUS, unary());
            }
            if (peek().is(TokenType.PLUS)) {
                advance();
                return new Expr.UnaryOp(Expr.Sign.PLUS, unary());
            }
            return primary();
        } finally {
            nesting--;
        }
    }

    private void enter() throws ParseException {
        if (++nesting > MAX_NESTING) {
            nesting--;
            throw new ParseException(peek().position(), "Formula nested too deeply");
        }
    }

    private Expr primary() throws ParseException {
        Token t = advance();
        switch (t.type()) {
            case NUMBER:
                return new Expr.NumberLit(t.number());
            case STRING:
                return new Expr.StringLit(t.text());
            case LPAREN: {
                Expr inner = expression();
                expect(TokenType.RPAREN, "Expected ')'");
                return inner;
            }
            case CELL_REF:
                if (peek().is(TokenType.LPAREN))
                    return call(t);
                Address from = toAddress(t);
                if (peek().is(TokenType.COLON)) {
                    advance();
                    Token end = advance();
                    if (!end.is(TokenType.CELL_REF))
                        throw new ParseException(end.position(), "Expected cell reference after ':'");
                    return new Expr.RangeRef(from, toAddress(end));
                }
                return new Expr.CellRef(from);
            case IDENTIFIER:
                if (peek().is(TokenType.LPAREN))
                    return call(t);
                throw new ParseException(t.position(), "Unknown identifier '" + t.text() + "'");
            case EOF:
                throw new ParseException(t.position(), "Unexpected end of formula");
            default:
                throw new ParseException(t.position(), "Unexpected '" + t.text() + "'");
        }
    }

    private Expr call(Token name) throws ParseException {
        expect(TokenType.LPAREN, "Expected '('");
        List<Expr> args = new ArrayList<>();
        if (!peek().is(TokenType.RPAREN)) {
            args.add(expression());
            while (peek().is(TokenType.COMMA)) {
                advance();
                args.add(expression());
            }
        }
        expect(TokenType.RPAREN, "Expected ')' to close " + name.text() + "(");
        return new Expr.Call(name.text(), args);
    }

    private static Address toAddress(Token t) throws ParseException {
        return Address.tryParse(t.text())
                .orElseThrow(() -> new ParseException(t.position(), "Invalid cell reference '" + t.text() + "'"));
    }

    private void expect(TokenType type, String message) throws ParseException {
        Token t = peek();
        if (!t.is(type))
            throw new ParseException(t.position(), message);
        advance();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token t = tokens.get(index);
        if (!t.is(TokenType.EOF))
            index++;
        return t;
    }

    private static String stripPosition(String message) {
        int at = message.lastIndexOf(" at position ");
        return at < 0 ? message : message.substring(0, at);
    }
}
