package com.formula.grid;

import com.formula.ast.Expr;
import com.formula.exception.ReadOnlyException;
import com.formula.layout.Position;
import com.formula.layout.Range;
import com.formula.value.Blank;
import com.formula.value.ScalarValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sheet keeping its cells in a map.
 */
public class InMemorySheet implements MutableView {

    private final String name;
    private final Map<Position, StoredCell> cells = new ConcurrentHashMap<>();
    private volatile boolean locked;

    public InMemorySheet(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Cell> cell(Position position) {
        return Optional.ofNullable(cells.get(position.coordinates()));
    }

    @Override
    public Range bounds() {
        if (cells.isEmpty()) {
            return Range.EMPTY;
        }
        long minRow = Long.MAX_VALUE;
        long minCol = Long.MAX_VALUE;
        long maxRow = 0;
        long maxCol = 0;
        for (Position pos : cells.keySet()) {
            minRow = Math.min(minRow, pos.row());
            minCol = Math.min(minCol, pos.column());
            maxRow = Math.max(maxRow, pos.row());
            maxCol = Math.max(maxCol, pos.column());
        }
        return new Range(Position.of(name, minCol, minRow), Position.of(name, maxCol, maxRow));
    }

    @Override
    public List<List<ScalarValue>> rows() {
        Range bounds = bounds();
        List<List<ScalarValue>> rows = new ArrayList<>();
        if (bounds.equals(Range.EMPTY)) {
            return rows;
        }
        for (long row = bounds.start().row(); row <= bounds.end().row(); row++) {
            List<ScalarValue> line = new ArrayList<>();
            for (long col = bounds.start().column(); col <= bounds.end().column(); col++) {
                StoredCell cell = cells.get(Position.of(col, row));
                line.add(cell == null ? Blank.INSTANCE : cell.value());
            }
            rows.add(line);
        }
        return rows;
    }

    @Override
    public MutableView mutable() {
        if (locked) {
            throw new ReadOnlyException(name);
        }
        return this;
    }

    @Override
    public boolean isLocked() {
        return locked;
    }

    /**
     * Protect the sheet: {@link #mutable()} and the setters fail from now on.
     */
    public void lock() {
        this.locked = true;
    }

    public void unlock() {
        this.locked = false;
    }

    @Override
    public void setValue(Position position, ScalarValue value) {
        checkWritable();
        Position key = position.coordinates();
        cells.put(key, new StoredCell(key, value == null ? Blank.INSTANCE : value, null));
    }

    @Override
    public void setFormula(Position position, Expr formula) {
        checkWritable();
        Position key = position.coordinates();
        cells.put(key, new StoredCell(key, Blank.INSTANCE, Objects.requireNonNull(formula, "formula")));
    }

    @Override
    public void clearCell(Position position) {
        checkWritable();
        cells.remove(position.coordinates());
    }

    public int size() {
        return cells.size();
    }

    private void checkWritable() {
        if (locked) {
            throw new ReadOnlyException(name);
        }
    }

    @Override
    public String toString() {
        return name;
    }

    private record StoredCell(Position position, ScalarValue value, Expr expr) implements Cell {

        @Override
        public String display() {
            return value.toString();
        }

        @Override
        public Optional<Expr> formula() {
            return Optional.ofNullable(expr);
        }
    }
}
