package com.houjicha;

/**
 * Token types produced by the {@link Lexer}. Full-width variants of the
 * operator characters map to the same type as their ASCII counterparts.
 */
public enum TokenType {
    // Structure markers
    HASH,           // #  claim
    CARET,          // ^  citation
    COLON,          // :  block / inline elaboration
    DOUBLE_COLON,   // :: namespace
    ARROW_LEFT,     // <= fact application
    ARROW_RIGHT,    // >> effect
    QUESTION,       // ?  issue
    PERCENT,        // %  norm
    AT,             // @  evaluation
    TILDE_ARROW,    // ~> reasons of an issue
    IMPLIES,        // => norm of an issue
    SEMICOLON,      // ;  reason statement

    // Logical operators
    AND,
    OR,

    // Conclusion markers
    PLUS,
    EXCLAIM,

    // Brackets
    LPAREN,
    RPAREN,
    LBRACKET_JP,    // 「
    RBRACKET_JP,    // 」
    ASTERISK,       // reserved; lexed but accepted by no production

    // Keywords and literals
    AS,
    DOLLAR,
    TEXT,

    // Layout
    NEWLINE,
    INDENT,
    DEDENT,
    COMMENT,
    EOF
}
