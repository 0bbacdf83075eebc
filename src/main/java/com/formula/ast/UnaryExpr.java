package com.formula.ast;

/**
 * Sign or percent applied to an operand.
 *
 * @param op      Operator
 * @param operand Operand
 */
public record UnaryExpr(UnaryOperator op, Expr operand) implements Expr {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public Expr cloneWithOffset(long lines, long columns) {
        return new UnaryExpr(op, operand.cloneWithOffset(lines, columns));
    }

    @Override
    public String toString() {
        if (!op.isPostfix()) {
            return op.getSymbol() + BinaryExpr.operand(operand);
        }
        if (operand instanceof UnaryExpr unary && !unary.op().isPostfix()) {
            return "(" + operand + ")" + op.getSymbol();
        }
        return BinaryExpr.operand(operand) + op.getSymbol();
    }
}
