package com.formula.parse;

import java.util.Set;

/**
 * Characters and keywords recognized by the lexer.
 */
public final class LexerConfig {

    private LexerConfig() {
    }

    /**
     * Keywords, only recognized in script mode.
     */
    public static final Set<String> KEYWORDS = Set.of(
            "let", "view", "sheet", "import", "from", "print",
            "use", "save", "export", "with", "default", "as", "to", "end"
    );

    /**
     * Operator and delimiter symbols.
     */
    public static final class Symbols {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_CURLY = '{';
        public static final char RIGHT_CURLY = '}';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char COMMA = ',';
        public static final char SEMICOLON = ';';
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char CARET = '^';
        public static final char AMPERSAND = '&';
        public static final char PERCENT = '%';
        public static final char EQUALS = '=';
        public static final char LESS = '<';
        public static final char GREATER = '>';
        public static final char COLON = ':';
        public static final char BANG = '!';
        public static final char DOT = '.';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char UNDERSCORE = '_';
        public static final char DOLLAR = '$';
        public static final char POUND = '#';
        public static final char SPACE = ' ';
        public static final char TAB = '\t';
        public static final char NEWLINE = '\n';
        public static final char CARRIAGE_RETURN = '\r';

        private Symbols() {
        }
    }
}
