package com.formula.exception;

/**
 * Exception thrown when a context does not support the requested lookup,
 * e.g. a cell lookup against a bare environment.
 */
public class NotAvailableException extends EvaluationException {

    public NotAvailableException(String message) {
        super(message);
    }
}
