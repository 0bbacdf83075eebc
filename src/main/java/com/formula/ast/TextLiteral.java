package com.formula.ast;

/**
 * Quoted text constant.
 * Rendered with double quotes, or single quotes when the text contains a double quote.
 *
 * @param value Text without the quotes
 */
public record TextLiteral(String value) implements Expr {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitText(this);
    }

    @Override
    public Expr cloneWithOffset(long lines, long columns) {
        return this;
    }

    @Override
    public String toString() {
        char quote = value.indexOf('"') >= 0 ? '\'' : '"';
        return quote + value + quote;
    }
}
