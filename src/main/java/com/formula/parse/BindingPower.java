package com.formula.parse;

/**
 * Binding powers of the formula grammar, from the loosest to the tightest.
 */
public enum BindingPower {
    LOWEST(0),
    EQUALITY(20),
    COMPARISON(30),
    CONCAT(40),
    ADDITIVE(50),
    MULTIPLICATIVE(60),
    POWER(70),
    UNARY(80),
    PERCENT(90),
    CALL(100);

    private final int value;

    BindingPower(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
