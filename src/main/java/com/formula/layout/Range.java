package com.formula.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Rectangular block of cells between two positions of the same sheet.
 * The bounds are kept in the order given; use {@link #normalize()} before iterating.
 *
 * @param start First corner
 * @param end   Opposite corner
 */
public record Range(Position start, Position end) {

    public static final Range EMPTY = new Range(Position.of(0, 0), Position.of(0, 0));

    public Range {
        if (start == null || end == null) {
            throw new IllegalArgumentException("range bounds must not be null");
        }
    }

    public String sheet() {
        return start.sheet();
    }

    /**
     * Rearrange the corners so that start is the top-left and end the bottom-right corner.
     */
    public Range normalize() {
        Position first = new Position(start.sheet(),
                Math.min(start.column(), end.column()),
                Math.min(start.row(), end.row()),
                start.absoluteColumn(), start.absoluteRow());
        Position last = new Position(start.sheet(),
                Math.max(start.column(), end.column()),
                Math.max(start.row(), end.row()),
                end.absoluteColumn(), end.absoluteRow());
        return new Range(first, last);
    }

    /**
     * Number of columns covered, bounds included.
     */
    public long width() {
        return Math.abs(end.column() - start.column()) + 1;
    }

    /**
     * Number of rows covered, bounds included.
     */
    public long height() {
        return Math.abs(end.row() - start.row()) + 1;
    }

    public Dimension dimension() {
        if (this.equals(EMPTY)) {
            return Dimension.EMPTY;
        }
        return new Dimension(height(), width());
    }

    public boolean contains(Position pos) {
        Range rg = normalize();
        return pos.row() >= rg.start.row() && pos.row() <= rg.end.row()
                && pos.column() >= rg.start.column() && pos.column() <= rg.end.column();
    }

    /**
     * All positions of the range, row by row.
     */
    public List<Position> positions() {
        Range rg = normalize();
        List<Position> list = new ArrayList<>();
        for (long row = rg.start.row(); row <= rg.end.row(); row++) {
            for (long col = rg.start.column(); col <= rg.end.column(); col++) {
                list.add(Position.of(rg.start.sheet(), col, row));
            }
        }
        return list;
    }

    @Override
    public String toString() {
        if (start.equals(end)) {
            return AddressCodec.encode(start);
        }
        return AddressCodec.encode(start) + ":" + AddressCodec.encode(end.withSheet(null));
    }
}
