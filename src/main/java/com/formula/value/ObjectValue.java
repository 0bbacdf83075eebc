package com.formula.value;

/**
 * Value exposing named properties, such as a workbook or one of its sheets.
 */
public non-sealed interface ObjectValue extends Value {

    /**
     * Read a property.
     *
     * @param name Property name
     * @return Property value
     * @throws com.formula.exception.EvaluationException if the object has no such property
     */
    Value get(String name);

    @Override
    default ValueKind kind() {
        return ValueKind.OBJECT;
    }
}
