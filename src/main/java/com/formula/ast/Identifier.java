package com.formula.ast;

/**
 * Bare name, resolved against the context at evaluation time.
 *
 * @param name Identifier name
 */
public record Identifier(String name) implements Expr {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public Expr cloneWithOffset(long lines, long columns) {
        return this;
    }

    @Override
    public String toString() {
        return name;
    }
}
