package com.formula.parse;

import com.formula.ast.Expr;

/**
 * Parse function for a token found at the start of an expression.
 */
@FunctionalInterface
public interface PrefixRule {

    /**
     * @param parser Parser, positioned right after {@code token}
     * @param token  Token that triggered the rule
     * @return Parsed expression
     */
    Expr parse(FormulaParser parser, Token token);
}
