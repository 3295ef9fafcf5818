package com.gridcalc.expr;

/**
 * A lexical token.
 *
 * @param type     token class
 * @param text     source text; identifiers and cell refs are upper-cased, string
 *                 literals are already unescaped
 * @param number   numeric value for {@link TokenType#NUMBER}, otherwise 0
 * @param position zero-based character offset in the formula body
 */
public record Token(TokenType type, String text, double number, int position) {

    public static Token of(TokenType type, String text, int position) {
        return new Token(type, text, 0.0, position);
    }

    public boolean is(TokenType t) {
        return type == t;
    }
}
