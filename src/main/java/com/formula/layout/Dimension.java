package com.formula.layout;

/**
 * Size of a rectangular block of cells.
 *
 * @param rows    Number of rows
 * @param columns Number of columns
 */
public record Dimension(long rows, long columns) {

    public static final Dimension EMPTY = new Dimension(0, 0);

    public boolean isEmpty() {
        return rows == 0 || columns == 0;
    }

    /**
     * Largest size on each axis.
     */
    public Dimension max(Dimension other) {
        return new Dimension(Math.max(rows, other.rows), Math.max(columns, other.columns));
    }

    @Override
    public String toString() {
        return rows + "x" + columns;
    }
}
