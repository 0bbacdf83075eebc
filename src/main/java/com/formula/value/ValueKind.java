package com.formula.value;

/**
 * Broad category of a value.
 */
public enum ValueKind {
    SCALAR,
    ERROR,
    ARRAY,
    OBJECT,
    FUNCTION
}
