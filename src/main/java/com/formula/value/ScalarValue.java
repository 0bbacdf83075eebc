package com.formula.value;

import com.formula.exception.IncompatibleTypeException;

/**
 * Single value stored in a cell.
 * <p>
 * Every variant knows how to coerce itself to a number, a text and a boolean.
 * Coercion never throws: a conversion that makes no sense gives an {@link ErrorValue}.
 * Comparison is only defined between values of the same variant, other combinations
 * throw an {@link IncompatibleTypeException}.
 */
public sealed interface ScalarValue extends Value
        permits Blank, NumberValue, TextValue, BooleanValue, DateValue, ErrorValue {

    /**
     * @return {@link NumberValue} or {@link ErrorValue}
     */
    ScalarValue toNumber();

    TextValue toText();

    /**
     * @return {@link BooleanValue} or {@link ErrorValue}
     */
    ScalarValue toBool();

    /**
     * @throws IncompatibleTypeException if {@code other} is another variant
     */
    boolean equal(ScalarValue other);

    /**
     * @throws IncompatibleTypeException if {@code other} is another variant
     */
    boolean less(ScalarValue other);

    @Override
    default ValueKind kind() {
        return ValueKind.SCALAR;
    }

    /**
     * Whether the value coerces to {@code true}. Errors are never truthy.
     */
    default boolean isTruthy() {
        return toBool() instanceof BooleanValue b && b.value();
    }

    default IncompatibleTypeException incompatible(ScalarValue other) {
        return new IncompatibleTypeException(typeName(), other.typeName());
    }
}
