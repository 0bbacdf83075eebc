package com.formula.value;

/**
 * Text.
 *
 * @param value Text, never null
 */
public record TextValue(String value) implements ScalarValue {

    public TextValue {
        if (value == null) {
            value = "";
        }
    }

    /**
     * Parse the text as a number, {@code #N/A} if it is not one.
     */
    @Override
    public ScalarValue toNumber() {
        try {
            return new NumberValue(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return ErrorValue.of(ErrorCode.NA);
        }
    }

    @Override
    public TextValue toText() {
        return this;
    }

    @Override
    public ScalarValue toBool() {
        return BooleanValue.of(!value.isEmpty());
    }

    @Override
    public boolean equal(ScalarValue other) {
        if (other instanceof TextValue t) {
            return value.equals(t.value);
        }
        throw incompatible(other);
    }

    @Override
    public boolean less(ScalarValue other) {
        if (other instanceof TextValue t) {
            return value.compareTo(t.value) < 0;
        }
        throw incompatible(other);
    }

    @Override
    public String typeName() {
        return "text";
    }

    @Override
    public String toString() {
        return value;
    }
}
