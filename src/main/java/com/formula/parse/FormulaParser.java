package com.formula.parse;

import com.formula.ast.Expr;
import com.formula.exception.SyntaxException;

/**
 * Pratt parser for formulas.
 * <p>
 * Turns the tokens of a {@link FormulaLexer} into an {@link Expr} tree, driven by the
 * prefix and infix tables of a {@link Grammar}. The parser keeps the current token and
 * one token of lookahead.
 * <p>
 * Parsing either returns a complete tree or throws a {@link SyntaxException}; there is no
 * error recovery. An instance keeps state while parsing and must not be shared between threads.
 */
public final class FormulaParser {

    private final Grammar grammar;
    private final ScanMode mode;
    private FormulaLexer lexer;
    private Token curr;
    private Token peek;

    public FormulaParser() {
        this(Grammar.formula(), ScanMode.FORMULA);
    }

    public FormulaParser(Grammar grammar, ScanMode mode) {
        this.grammar = grammar;
        this.mode = mode;
    }

    /**
     * Parse a complete formula.
     *
     * @param text Formula text, with or without leading {@code =}
     * @return Root of the expression tree
     * @throws SyntaxException if the text is not a valid formula
     */
    public Expr parse(String text) {
        lexer = new FormulaLexer(text, mode);
        curr = lexer.scan();
        peek = lexer.scan();

        Expr expr = parseExpression(BindingPower.LOWEST.value());
        if (!curr.is(TokenType.EOF)) {
            throw error(curr, "unexpected token " + curr);
        }
        return expr;
    }

    /**
     * Parse an expression whose operators bind tighter than {@code power}.
     */
    Expr parseExpression(int power) {
        Token token = advance();
        if (token.is(TokenType.INVALID)) {
            throw error(token, "invalid token " + token.literal());
        }
        PrefixRule prefix = grammar.prefix(token.type());
        if (prefix == null) {
            throw error(token, "unexpected token " + token);
        }
        Expr left = prefix.parse(this, token);

        while (power < grammar.power(curr.type()).value()) {
            InfixRule infix = grammar.infix(curr.type());
            if (infix == null) {
                break;
            }
            Token op = advance();
            left = infix.parse(this, left, op);
        }
        return left;
    }

    Token current() {
        return curr;
    }

    Token lookahead() {
        return peek;
    }

    boolean check(TokenType type) {
        return curr.is(type);
    }

    /**
     * Consume the current token.
     *
     * @return The consumed token
     */
    Token advance() {
        Token token = curr;
        curr = peek;
        peek = lexer.scan();
        return token;
    }

    void expect(TokenType type, String message) {
        if (curr.is(TokenType.INVALID)) {
            throw error(curr, "invalid token " + curr.literal());
        }
        if (!curr.is(type)) {
            throw error(curr, message + ", got " + curr);
        }
        advance();
    }

    SyntaxException error(Token token, String message) {
        return new SyntaxException(message, token.line(), token.column());
    }
}
