package com.formula.value;

import com.formula.layout.Dimension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * Two-dimensional grid of scalars, typically the content of a range.
 * <p>
 * Indices are zero-based. Reading outside the grid gives {@link Blank}, writing outside is ignored.
 */
public final class ArrayValue implements Value {

    private final ScalarValue[][] data;
    private final int rows;
    private final int columns;

    private ArrayValue(ScalarValue[][] data) {
        this.data = data;
        this.rows = data.length;
        this.columns = rows == 0 ? 0 : data[0].length;
    }

    /**
     * Create an array filled with blanks.
     */
    public static ArrayValue blank(int rows, int columns) {
        ScalarValue[][] data = new ScalarValue[rows][columns];
        for (ScalarValue[] row : data) {
            Arrays.fill(row, Blank.INSTANCE);
        }
        return new ArrayValue(data);
    }

    /**
     * Create an array from its rows. Short rows are padded with blanks.
     */
    public static ArrayValue of(List<List<ScalarValue>> rows) {
        int width = rows.stream().mapToInt(List::size).max().orElse(0);
        ArrayValue array = blank(rows.size(), width);
        for (int i = 0; i < rows.size(); i++) {
            List<ScalarValue> row = rows.get(i);
            for (int j = 0; j < row.size(); j++) {
                array.set(i, j, row.get(j));
            }
        }
        return array;
    }

    /**
     * Create a single-column array.
     */
    public static ArrayValue column(ScalarValue... values) {
        ArrayValue array = blank(values.length, values.length == 0 ? 0 : 1);
        for (int i = 0; i < values.length; i++) {
            array.set(i, 0, values[i]);
        }
        return array;
    }

    /**
     * Create a 1x1 array holding a single scalar.
     */
    public static ArrayValue scalar(ScalarValue value) {
        return column(value);
    }

    public ScalarValue get(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= columns) {
            return Blank.INSTANCE;
        }
        return data[row][col];
    }

    public void set(int row, int col, ScalarValue value) {
        if (row < 0 || row >= rows || col < 0 || col >= columns) {
            return;
        }
        data[row][col] = value == null ? Blank.INSTANCE : value;
    }

    public Dimension dimension() {
        return new Dimension(rows, columns);
    }

    /**
     * Apply a function to every element.
     * An exception thrown by the function aborts the whole operation.
     *
     * @return New array of the same size
     */
    public ArrayValue apply(UnaryOperator<ScalarValue> fn) {
        ArrayValue result = blank(rows, columns);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                result.set(i, j, fn.apply(data[i][j]));
            }
        }
        return result;
    }

    /**
     * Combine two arrays element by element.
     * <p>
     * The result has the largest size of both arrays on each axis. The smaller array is
     * repeated to fill it, so a 1x1 array is combined with every element of the other one.
     *
     * @return New array
     */
    public ArrayValue applyWith(ArrayValue other, BinaryOperator<ScalarValue> fn) {
        Dimension dim = dimension().max(other.dimension());
        if (dimension().isEmpty() || other.dimension().isEmpty()) {
            return blank(0, 0);
        }
        ArrayValue result = blank((int) dim.rows(), (int) dim.columns());
        for (int i = 0; i < dim.rows(); i++) {
            for (int j = 0; j < dim.columns(); j++) {
                ScalarValue left = get(i % rows, j % columns);
                ScalarValue right = other.get(i % other.rows, j % other.columns);
                result.set(i, j, fn.apply(left, right));
            }
        }
        return result;
    }

    /**
     * All elements, row by row.
     */
    public List<ScalarValue> values() {
        List<ScalarValue> list = new ArrayList<>(rows * columns);
        for (ScalarValue[] row : data) {
            list.addAll(Arrays.asList(row));
        }
        return list;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.ARRAY;
    }

    @Override
    public String typeName() {
        return "array(" + rows + ", " + columns + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArrayValue other)) {
            return false;
        }
        return Arrays.deepEquals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(data);
    }

    /**
     * Array literal notation: {@code {1, 2; 3, 4}}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < rows; i++) {
            if (i > 0) {
                sb.append("; ");
            }
            for (int j = 0; j < columns; j++) {
                if (j > 0) {
                    sb.append(", ");
                }
                sb.append(data[i][j]);
            }
        }
        return sb.append('}').toString();
    }
}
