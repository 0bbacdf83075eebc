package com.formula.value;

/**
 * Logical value.
 *
 * @param value Boolean
 */
public record BooleanValue(boolean value) implements ScalarValue {

    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    public static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public ScalarValue toNumber() {
        return new NumberValue(value ? 1 : 0);
    }

    @Override
    public TextValue toText() {
        return new TextValue(Boolean.toString(value));
    }

    @Override
    public ScalarValue toBool() {
        return this;
    }

    @Override
    public boolean equal(ScalarValue other) {
        if (other instanceof BooleanValue b) {
            return value == b.value;
        }
        throw incompatible(other);
    }

    /**
     * {@code false} sorts before {@code true}.
     */
    @Override
    public boolean less(ScalarValue other) {
        if (other instanceof BooleanValue b) {
            return !value && b.value;
        }
        throw incompatible(other);
    }

    @Override
    public String typeName() {
        return "boolean";
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
