package org.carball.rlsguard.parser;

/**
 * Token types for policy expressions.
 */
public enum TokenType {
    // Words: identifiers, keywords, numerals, casts
    WORD,
    QUOTED,

    // Delimiters
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    COMMA,

    // One of = < > !
    OPERATOR
}
