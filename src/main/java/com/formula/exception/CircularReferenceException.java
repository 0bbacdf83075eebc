package com.formula.exception;

/**
 * Exception thrown when a formula cell depends, directly or indirectly, on itself.
 */
public class CircularReferenceException extends EvaluationException {

    private final String address;

    public CircularReferenceException(String address) {
        super("Circular reference detected at " + address);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
