package com.formula.exception;

/**
 * Exception thrown when a text is not a valid cell address.
 */
public class InvalidAddressException extends FormulaException {

    public InvalidAddressException(String message) {
        super(message);
    }
}
