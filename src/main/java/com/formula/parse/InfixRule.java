package com.formula.parse;

import com.formula.ast.Expr;

/**
 * Parse function for a token found after a complete left operand.
 */
@FunctionalInterface
public interface InfixRule {

    /**
     * @param parser Parser, positioned right after {@code token}
     * @param left   Already parsed left operand
     * @param token  Operator token
     * @return Parsed expression
     */
    Expr parse(FormulaParser parser, Expr left, Token token);
}
