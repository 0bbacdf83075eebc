package com.formula.parse;

import java.util.ArrayList;
import java.util.List;

import static com.formula.parse.LexerConfig.*;

/**
 * Lexer for formulas.
 * <p>
 * Produces tokens lazily through {@link #scan()} in a single forward pass over the input.
 * Lexing never fails: an unterminated literal or an unknown character yields an
 * {@link TokenType#INVALID} token and the parser reports the syntax error.
 */
public final class FormulaLexer {

    private final String input;
    private final int length;
    private final ScanMode mode;
    private int pos;
    private int line;
    private int column;

    public FormulaLexer(String input) {
        this(input, ScanMode.FORMULA);
    }

    public FormulaLexer(String input, ScanMode mode) {
        this.input = input == null ? "" : input;
        this.length = this.input.length();
        this.mode = mode;
        this.pos = 0;
        this.line = 1;
        this.column = 1;

        // "=A1+1" is the usual way to type a formula in a cell
        if (!isAtEnd() && peek() == Symbols.EQUALS) {
            advance();
        }
    }

    public ScanMode mode() {
        return mode;
    }

    /**
     * Scan all remaining tokens.
     *
     * @return List of tokens, the last one being {@link TokenType#EOF}
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token tok;
        do {
            tok = scan();
            tokens.add(tok);
        } while (tok.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * Scan the next token.
     * Once the input is exhausted, every call returns an {@link TokenType#EOF} token.
     *
     * @return Next token
     */
    public Token scan() {
        skipBlanks();
        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        int startLine = line;
        int startColumn = column;
        char c = peek();

        if (isNewline(c) && isScript()) {
            skipNewlines();
            return new Token(TokenType.EOL, "", startLine, startColumn);
        }
        if (c == Symbols.POUND && isScript()) {
            return readComment(startLine, startColumn);
        }
        if (isQuote(c)) {
            return readLiteral(startLine, startColumn);
        }
        if (isDigit(c)) {
            return readNumber(startLine, startColumn);
        }
        if (isIdentifierPart(c)) {
            return readIdentifier(startLine, startColumn);
        }

        int start = pos;
        advance();
        TokenType type = switch (c) {
            case Symbols.LEFT_PAREN -> TokenType.BEG_GROUP;
            case Symbols.RIGHT_PAREN -> TokenType.END_GROUP;
            case Symbols.LEFT_CURLY -> TokenType.BEG_BLOCK;
            case Symbols.RIGHT_CURLY -> TokenType.END_BLOCK;
            case Symbols.LEFT_BRACKET -> TokenType.BEG_PROP;
            case Symbols.RIGHT_BRACKET -> TokenType.END_PROP;
            case Symbols.COMMA, Symbols.SEMICOLON -> TokenType.COMMA;
            case Symbols.DOT -> TokenType.DOT;
            case Symbols.PERCENT -> TokenType.PERCENT;
            case Symbols.BANG -> TokenType.SHEET_REF;
            case Symbols.EQUALS -> TokenType.EQ;
            case Symbols.PLUS -> assignOr(TokenType.ADD, TokenType.ADD_ASSIGN);
            case Symbols.MINUS -> assignOr(TokenType.SUB, TokenType.SUB_ASSIGN);
            case Symbols.STAR -> assignOr(TokenType.MUL, TokenType.MUL_ASSIGN);
            case Symbols.SLASH -> assignOr(TokenType.DIV, TokenType.DIV_ASSIGN);
            case Symbols.CARET -> assignOr(TokenType.POW, TokenType.POW_ASSIGN);
            case Symbols.AMPERSAND -> assignOr(TokenType.CONCAT, TokenType.CONCAT_ASSIGN);
            case Symbols.COLON -> assignOr(TokenType.RANGE_REF, TokenType.ASSIGN);
            case Symbols.LESS -> {
                if (match(Symbols.EQUALS)) {
                    yield TokenType.LE;
                }
                if (match(Symbols.GREATER)) {
                    yield TokenType.NE;
                }
                yield TokenType.LT;
            }
            case Symbols.GREATER -> match(Symbols.EQUALS) ? TokenType.GE : TokenType.GT;
            default -> TokenType.INVALID;
        };
        return new Token(type, input.substring(start, pos), startLine, startColumn);
    }

    private TokenType assignOr(TokenType plain, TokenType assign) {
        if (isScript() && match(Symbols.EQUALS)) {
            return assign;
        }
        return plain;
    }

    private Token readIdentifier(int startLine, int startColumn) {
        int start = pos;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        String text = input.substring(start, pos);
        if (isScript() && KEYWORDS.contains(text)) {
            return new Token(TokenType.KEYWORD, text, startLine, startColumn);
        }
        return new Token(TokenType.IDENT, text, startLine, startColumn);
    }

    private Token readNumber(int startLine, int startColumn) {
        int start = pos;
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        if (!isAtEnd() && peek() == Symbols.DOT) {
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), startLine, startColumn);
    }

    private Token readLiteral(int startLine, int startColumn) {
        char quote = advance();
        int start = pos;
        while (!isAtEnd() && peek() != quote) {
            advance();
        }
        String text = input.substring(start, pos);
        if (isAtEnd()) {
            return new Token(TokenType.INVALID, quote + text, startLine, startColumn);
        }
        advance(); // closing quote
        return new Token(TokenType.LITERAL, text, startLine, startColumn);
    }

    private Token readComment(int startLine, int startColumn) {
        advance(); // '#'
        while (!isAtEnd() && isBlank(peek())) {
            advance();
        }
        int start = pos;
        while (!isAtEnd() && !isNewline(peek())) {
            advance();
        }
        String text = input.substring(start, pos);
        skipNewlines();
        return new Token(TokenType.COMMENT, text, startLine, startColumn);
    }

    private void skipBlanks() {
        while (!isAtEnd()) {
            char c = peek();
            if (isBlank(c) || (isNewline(c) && !isScript())) {
                advance();
                continue;
            }
            break;
        }
    }

    private void skipNewlines() {
        while (!isAtEnd() && isNewline(peek())) {
            advance();
        }
    }

    private boolean isScript() {
        return mode == ScanMode.SCRIPT;
    }

    private boolean match(char expected) {
        if (isAtEnd() || peek() != expected) {
            return false;
        }
        advance();
        return true;
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == Symbols.NEWLINE) {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private static boolean isQuote(char c) {
        return c == Symbols.QUOTE_SINGLE || c == Symbols.QUOTE_DOUBLE;
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == Symbols.UNDERSCORE;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierPart(char c) {
        return isLetter(c) || isDigit(c) || c == Symbols.DOLLAR;
    }

    private static boolean isBlank(char c) {
        return c == Symbols.SPACE || c == Symbols.TAB;
    }

    private static boolean isNewline(char c) {
        return c == Symbols.NEWLINE || c == Symbols.CARRIAGE_RETURN;
    }
}
