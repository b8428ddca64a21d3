package com.houjicha.ast;

/**
 * A free-standing reasoning note on its own line, {@code ; content}.
 */
public record ReasonStatement(
    Range range,
    String content
) implements Node {

    @Override
    public String type() {
        return "ReasonStatement";
    }
}
