package com.formula.layout;

/**
 * Address of a cell.
 * <p>
 * Column and row are 1-based; 0 means "unset". A {@code null} sheet means the
 * position is not qualified and resolves against the current sheet.
 *
 * @param sheet          Optional sheet qualifier
 * @param column         Column index (A=1, Z=26, AA=27...)
 * @param row            Row index
 * @param absoluteColumn Whether the column was marked with {@code $}
 * @param absoluteRow    Whether the row was marked with {@code $}
 */
public record Position(String sheet, long column, long row, boolean absoluteColumn, boolean absoluteRow) {

    public Position {
        if (column < 0 || row < 0) {
            throw new IllegalArgumentException("column and row must be positive: " + column + ", " + row);
        }
        if (sheet != null && sheet.isEmpty()) {
            sheet = null;
        }
    }

    /**
     * Create a relative, unqualified position.
     */
    public static Position of(long column, long row) {
        return new Position(null, column, row, false, false);
    }

    /**
     * Create a relative position qualified with a sheet name.
     */
    public static Position of(String sheet, long column, long row) {
        return new Position(sheet, column, row, false, false);
    }

    public boolean isQualified() {
        return sheet != null;
    }

    public boolean isUnset() {
        return column == 0 && row == 0;
    }

    public Position withSheet(String name) {
        return new Position(name, column, row, absoluteColumn, absoluteRow);
    }

    /**
     * Same column and row without sheet qualifier nor absolute markers.
     * Used as the lookup key of a cell inside one view.
     */
    public Position coordinates() {
        if (sheet == null && !absoluteColumn && !absoluteRow) {
            return this;
        }
        return new Position(null, column, row, false, false);
    }

    @Override
    public String toString() {
        return AddressCodec.encode(this);
    }
}
