package com.houjicha;

import com.houjicha.ast.Range;

/**
 * A diagnostic produced while parsing. Lexical errors are carried through with
 * the same shape.
 */
public record ParseError(String message, Range range) {

    public static ParseError of(LexError error) {
        return new ParseError(error.message(), error.range());
    }

    @Override
    public String toString() {
        return (range.start().line() + 1) + ":" + (range.start().column() + 1) + ": " + message;
    }
}
