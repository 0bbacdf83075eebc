package com.formula.grid;

import com.formula.exception.ReadOnlyException;
import com.formula.layout.Position;
import com.formula.layout.Range;
import com.formula.value.ScalarValue;

import java.util.List;
import java.util.Optional;

/**
 * Named, addressable block of cells, usually a sheet of a workbook.
 * <p>
 * This is the only way the evaluator reaches stored data.
 */
public interface View {

    String name();

    /**
     * Look up a cell. Only the column and row of the position are used.
     *
     * @param position Cell address
     * @return The cell, or empty if nothing is stored there
     */
    Optional<Cell> cell(Position position);

    /**
     * Smallest range holding every stored cell, {@link Range#EMPTY} when the view is empty.
     */
    Range bounds();

    /**
     * Values of the cells within {@link #bounds()}, row by row.
     */
    List<List<ScalarValue>> rows();

    /**
     * Writable access to the view.
     *
     * @throws ReadOnlyException if the view can not be modified
     */
    MutableView mutable();

    /**
     * Whether the view is protected against modification by its owner.
     */
    default boolean isLocked() {
        return false;
    }
}
