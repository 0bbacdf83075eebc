package com.formula.function;

import com.formula.value.ScalarValue;

/**
 * Test applied to every element a reducer aggregates.
 */
@FunctionalInterface
public interface Predicate {

    boolean test(ScalarValue value);

    /**
     * Predicate accepting every value.
     */
    static Predicate always() {
        return value -> true;
    }
}
