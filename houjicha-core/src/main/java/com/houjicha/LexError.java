package com.houjicha;

import com.houjicha.ast.Range;

/**
 * A malformed or unrecognized character sequence reported by the {@link Lexer}.
 */
public record LexError(String message, Range range) {
}
