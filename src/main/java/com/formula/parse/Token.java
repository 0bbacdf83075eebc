package com.formula.parse;

import java.util.Locale;

/**
 * Represents a token of a formula.
 *
 * @param type    Token type
 * @param literal Text of the token (without quotes for literals)
 * @param line    Line of the first character, starting at 1
 * @param column  Column of the first character, starting at 1
 */
public record Token(TokenType type, String literal, int line, int column) {

    public boolean is(TokenType kind) {
        return type == kind;
    }

    @Override
    public String toString() {
        return switch (type) {
            case EOF -> "<eof>";
            case EOL -> "<eol>";
            case INVALID -> "<invalid(" + literal + ")>";
            case IDENT, KEYWORD, NUMBER, LITERAL, COMMENT -> type.name().toLowerCase(Locale.ROOT) + "(" + literal + ")";
            default -> "<" + type.name().toLowerCase(Locale.ROOT).replace('_', '-') + ">";
        };
    }
}
