package com.formula.value;

/**
 * Result of evaluating a formula.
 * <p>
 * The set of variants is closed: scalars, arrays of scalars, objects exposing
 * named properties and callable functions. {@link #toString()} gives the display form.
 */
public sealed interface Value permits ScalarValue, ArrayValue, ObjectValue, FunctionValue {

    ValueKind kind();

    /**
     * Name of the type as reported by the {@code typeof} function.
     */
    String typeName();

    default boolean isError() {
        return kind() == ValueKind.ERROR;
    }
}
