package com.formula.exception;

/**
 * Exception thrown when mutable access is requested on a read-only or protected view.
 */
public class ReadOnlyException extends EvaluationException {

    public ReadOnlyException(String viewName) {
        super(viewName + ": view is not mutable");
    }
}
