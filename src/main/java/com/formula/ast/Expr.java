package com.formula.ast;

/**
 * Node of a parsed formula.
 * <p>
 * Nodes are immutable. {@link #toString()} renders the node back to formula text.
 */
public sealed interface Expr
        permits Identifier, NumberLiteral, TextLiteral, UnaryExpr, BinaryExpr, CallExpr, CellRef, RangeRef {

    /**
     * Dispatch to the visitor method matching this node.
     */
    <R> R accept(ExprVisitor<R> visitor);

    /**
     * Copy this node moving every relative cell reference by the given delta.
     * Used when a formula is copied to another cell.
     *
     * @param lines   Number of rows to add
     * @param columns Number of columns to add
     * @return Independent copy of the tree
     * @throws com.formula.exception.InvalidAddressException if a reference moves before row or column 1
     */
    Expr cloneWithOffset(long lines, long columns);
}
