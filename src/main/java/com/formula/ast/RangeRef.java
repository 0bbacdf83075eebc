package com.formula.ast;

/**
 * Reference to a rectangular block of cells.
 *
 * @param start First corner
 * @param end   Opposite corner
 */
public record RangeRef(CellRef start, CellRef end) implements Expr {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public Expr cloneWithOffset(long lines, long columns) {
        return new RangeRef(start.cloneWithOffset(lines, columns), end.cloneWithOffset(lines, columns));
    }

    @Override
    public String toString() {
        return start + ":" + new CellRef(end.position().withSheet(null));
    }
}
