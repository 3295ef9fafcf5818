package com.gridcalc.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a formula body (the text after the leading {@code =}) into tokens.
 *
 * Identifiers are upper-cased, so {@code sum(a1)} and {@code SUM(A1)} lex the
 * same. An identifier of the form {@code LETTERS DIGITS} is a cell reference
 * candidate; the parser decides whether it is used as a reference or as a
 * function name.
 */
public final class Lexer {
    private final String input;
    private int pos;

    public Lexer(String input) {
        this.input = input;
    }

    public static List<Token> tokenize(String input) throws ParseException {
        return new Lexer(input).tokenize();
    }

    public List<Token> tokenize() throws ParseException {
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = next();
            tokens.add(t);
        } while (!t.is(TokenType.EOF));
        return tokens;
    }

    private Token next() throws ParseException {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos)))
            pos++;
        if (pos >= input.length())
            return Token.of(TokenType.EOF, "", pos);

        int start = pos;
        char c = input.charAt(pos);

        if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))))
            return readNumber();
        if (isLetter(c))
            return readIdentifier();
        if (c == '"')
            return readString();

        pos++;
        return switch (c) {
            case '+' -> Token.of(TokenType.PLUS, "+", start);
            case '-' -> Token.of(TokenType.MINUS, "-", start);
            case '*' -> {
                if (peek() == '*') {
                    pos++;
                    yield Token.of(TokenType.POWER, "**", start);
                }
                yield Token.of(TokenType.STAR, "*", start);
            }
            case '^' -> Token.of(TokenType.POWER, "^", start);
            case '/' -> Token.of(TokenType.SLASH, "/", start);
            case '%' -> Token.of(TokenType.PERCENT, "%", start);
            case '&' -> Token.of(TokenType.AMPERSAND, "&", start);
            case '=' -> Token.of(TokenType.EQ, "=", start);
            case '<' -> {
                if (peek() == '=') {
                    pos++;
                    yield Token.of(TokenType.LE, "<=", start);
                }
                if (peek() == '>') {
                    pos++;
                    yield Token.of(TokenType.NE, "<>", start);
                }
                yield Token.of(TokenType.LT, "<", start);
            }
            case '>' -> {
                if (peek() == '=') {
                    pos++;
                    yield Token.of(TokenType.GE, ">=", start);
                }
                yield Token.of(TokenType.GT, ">", start);
            }
            case '(' -> Token.of(TokenType.LPAREN, "(", start);
            case ')' -> Token.of(TokenType.RPAREN, ")", start);
            case ',' -> Token.of(TokenType.COMMA, ",", start);
            case ':' -> Token.of(TokenType.COLON, ":", start);
            default -> throw new ParseException(start, "Unexpected character '" + c + "'");
        };
    }

    private Token readNumber() throws ParseException {
        int start = pos;
        while (pos < input.length() && isDigit(input.charAt(pos)))
            pos++;
        if (pos < input.length() && input.charAt(pos) == '.') {
            pos++;
            while (pos < input.length() && isDigit(input.charAt(pos)))
                pos++;
        }
        String text = input.substring(start, pos);
        if (pos < input.length() && input.charAt(pos) == '.')
            throw new ParseException(pos, "Malformed number '" + text + ".'");
        return new Token(TokenType.NUMBER, text, Double.parseDouble(text), start);
    }

    private Token readIdentifier() {
        int start = pos;
        while (pos < input.length() && (isLetter(input.charAt(pos)) || isDigit(input.charAt(pos)) || input.charAt(pos) == '_'))
            pos++;
        String text = input.substring(start, pos).toUpperCase();
        return Token.of(looksLikeCellRef(text) ? TokenType.CELL_REF : TokenType.IDENTIFIER, text, start);
    }

    private Token readString() throws ParseException {
        int start = pos;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                if (peekAt(pos + 1) == '"') {
                    sb.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return Token.of(TokenType.STRING, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new ParseException(start, "Unterminated string literal");
    }

    private char peek() {
        return peekAt(pos);
    }

    private char peekAt(int i) {
        return i < input.length() ? input.charAt(i) : '\0';
    }

    static boolean looksLikeCellRef(String upper) {
        int i = 0;
        while (i < upper.length() && upper.charAt(i) >= 'A' && upper.charAt(i) <= 'Z')
            i++;
        if (i == 0 || i == upper.length())
            return false;
        for (int j = i; j < upper.length(); j++)
            if (!isDigit(upper.charAt(j)))
                return false;
        return true;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
