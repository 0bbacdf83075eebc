package com.formula.exception;

/**
 * Exception thrown when two values of different variants are compared.
 * The evaluator turns it into a {@code #VALUE!} error.
 */
public class IncompatibleTypeException extends FormulaException {

    public IncompatibleTypeException(String left, String right) {
        super("incompatible type: " + left + " and " + right);
    }
}
