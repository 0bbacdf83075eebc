package com.formula.exception;

/**
 * Exception thrown when a call targets a value that is not a function.
 */
public class NotCallableException extends EvaluationException {

    public NotCallableException(String name) {
        super(name + ": expression is not callable");
    }
}
