package com.formula.ast;

/**
 * Operators of unary expressions. {@link #PERCENT} follows its operand.
 */
public enum UnaryOperator {
    PLUS("+"),
    MINUS("-"),
    PERCENT("%");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isPostfix() {
        return this == PERCENT;
    }
}
