package com.formula.ast;

import com.formula.layout.AddressCodec;
import com.formula.layout.Position;

/**
 * Reference to a single cell.
 * The absolute markers of the reference are carried by the position.
 *
 * @param position Referenced cell
 */
public record CellRef(Position position) implements Expr {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCell(this);
    }

    @Override
    public CellRef cloneWithOffset(long lines, long columns) {
        return new CellRef(AddressCodec.offset(position, lines, columns));
    }

    public boolean absoluteColumn() {
        return position.absoluteColumn();
    }

    public boolean absoluteRow() {
        return position.absoluteRow();
    }

    @Override
    public String toString() {
        return AddressCodec.encode(position);
    }
}
