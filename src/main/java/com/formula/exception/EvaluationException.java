package com.formula.exception;

/**
 * Exception thrown when a formula can not be evaluated.
 * <p>
 * Only structural failures are reported this way. Bad input data produces
 * an in-language error value instead.
 */
public class EvaluationException extends FormulaException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
