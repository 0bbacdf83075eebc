package com.formula.value;

import java.math.BigDecimal;

/**
 * Floating point number.
 *
 * @param value Number
 */
public record NumberValue(double value) implements ScalarValue {

    @Override
    public ScalarValue toNumber() {
        return this;
    }

    @Override
    public TextValue toText() {
        return new TextValue(format(value));
    }

    @Override
    public ScalarValue toBool() {
        return BooleanValue.of(value != 0);
    }

    @Override
    public boolean equal(ScalarValue other) {
        if (other instanceof NumberValue n) {
            return value == n.value;
        }
        throw incompatible(other);
    }

    @Override
    public boolean less(ScalarValue other) {
        if (other instanceof NumberValue n) {
            return value < n.value;
        }
        throw incompatible(other);
    }

    @Override
    public String typeName() {
        return "number";
    }

    @Override
    public String toString() {
        return format(value);
    }

    /**
     * Shortest plain rendering of a number: {@code 2} rather than {@code 2.0}, never exponent notation.
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
