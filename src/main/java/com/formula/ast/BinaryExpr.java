package com.formula.ast;

/**
 * Operator applied to two operands.
 *
 * @param op    Operator
 * @param left  Left operand
 * @param right Right operand
 */
public record BinaryExpr(BinaryOperator op, Expr left, Expr right) implements Expr {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public Expr cloneWithOffset(long lines, long columns) {
        return new BinaryExpr(op, left.cloneWithOffset(lines, columns), right.cloneWithOffset(lines, columns));
    }

    /**
     * Nested binary operands are parenthesized so the text parses back to the same tree.
     */
    @Override
    public String toString() {
        return operand(left) + " " + op.getSymbol() + " " + operand(right);
    }

    static String operand(Expr expr) {
        if (expr instanceof BinaryExpr) {
            return "(" + expr + ")";
        }
        return expr.toString();
    }
}
