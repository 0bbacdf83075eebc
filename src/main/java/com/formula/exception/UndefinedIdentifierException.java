package com.formula.exception;

/**
 * Exception thrown when no context of a chain binds the requested identifier.
 */
public class UndefinedIdentifierException extends EvaluationException {

    private final String identifier;

    public UndefinedIdentifierException(String identifier) {
        super(identifier + ": undefined identifier");
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
