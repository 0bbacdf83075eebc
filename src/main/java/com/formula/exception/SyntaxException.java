package com.formula.exception;

/**
 * Exception thrown when a formula can not be tokenized or parsed.
 * Carries the line and column of the offending token.
 */
public class SyntaxException extends FormulaException {

    private final int line;
    private final int column;

    public SyntaxException(String message, int line, int column) {
        super(message + " at " + line + ":" + column);
        this.line = line;
        this.column = column;
    }

    public SyntaxException(String message, int line, int column, Throwable cause) {
        super(message + " at " + line + ":" + column, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
