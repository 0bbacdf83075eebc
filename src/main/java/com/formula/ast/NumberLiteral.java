package com.formula.ast;

import com.formula.value.NumberValue;

/**
 * Numeric constant.
 *
 * @param value Number value
 */
public record NumberLiteral(double value) implements Expr {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public Expr cloneWithOffset(long lines, long columns) {
        return this;
    }

    @Override
    public String toString() {
        return NumberValue.format(value);
    }
}
