package com.formula.value;

/**
 * Value of an empty cell.
 */
public final class Blank implements ScalarValue {

    public static final Blank INSTANCE = new Blank();

    private Blank() {
    }

    @Override
    public ScalarValue toNumber() {
        return new NumberValue(0);
    }

    @Override
    public TextValue toText() {
        return new TextValue("");
    }

    @Override
    public ScalarValue toBool() {
        return BooleanValue.FALSE;
    }

    @Override
    public boolean equal(ScalarValue other) {
        if (other instanceof Blank) {
            return true;
        }
        throw incompatible(other);
    }

    @Override
    public boolean less(ScalarValue other) {
        if (other instanceof Blank) {
            return false;
        }
        throw incompatible(other);
    }

    @Override
    public String typeName() {
        return "blank";
    }

    @Override
    public String toString() {
        return "";
    }
}
