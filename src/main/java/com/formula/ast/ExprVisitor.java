package com.formula.ast;

/**
 * Visitor over the closed set of formula nodes.
 *
 * @param <R> Result type
 */
public interface ExprVisitor<R> {

    R visitIdentifier(Identifier expr);

    R visitNumber(NumberLiteral expr);

    R visitText(TextLiteral expr);

    R visitUnary(UnaryExpr expr);

    R visitBinary(BinaryExpr expr);

    R visitCall(CallExpr expr);

    R visitCell(CellRef expr);

    R visitRange(RangeRef expr);
}
