package com.formula.parse;

/**
 * Token types for formula scanning.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    KEYWORD,
    NUMBER,
    LITERAL,
    COMMENT,

    // Arithmetic operators
    ADD,
    SUB,
    MUL,
    DIV,
    PERCENT,
    POW,
    CONCAT,

    // Comparison operators
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,

    // Assignment (script mode)
    ASSIGN,
    ADD_ASSIGN,
    SUB_ASSIGN,
    MUL_ASSIGN,
    DIV_ASSIGN,
    POW_ASSIGN,
    CONCAT_ASSIGN,

    // Delimiters
    COMMA,
    DOT,
    BEG_GROUP,
    END_GROUP,
    BEG_BLOCK,
    END_BLOCK,
    BEG_PROP,
    END_PROP,

    // References
    RANGE_REF,
    SHEET_REF,

    // Special
    EOL,
    EOF,
    INVALID
}
