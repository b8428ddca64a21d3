package com.houjicha;

import com.houjicha.ast.Position;
import com.houjicha.ast.Range;

/**
 * A lexical token.
 *
 * @param type  Token type
 * @param value Source text of the token (trimmed for TEXT and COMMENT, empty for layout tokens)
 * @param range Source extent
 */
public record Token(TokenType type, String value, Range range) {

    public Position start() {
        return range.start();
    }

    public Position end() {
        return range.end();
    }

    @Override
    public String toString() {
        if (value.isEmpty()) {
            return type.toString();
        }
        return type + "(" + value + ")";
    }
}
