package com.formula.parse;

/**
 * Scanning mode of the lexer.
 */
public enum ScanMode {
    /**
     * Single formula: line breaks are whitespace, no keywords, no comments.
     */
    FORMULA,

    /**
     * Line oriented script: line breaks and {@code #} comments are significant,
     * keywords and assignment operators are recognized.
     */
    SCRIPT
}
