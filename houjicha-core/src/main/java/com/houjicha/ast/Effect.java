package com.houjicha.ast;

/**
 * Legal consequence of a claim, {@code >> content}.
 */
public record Effect(
    Range range,
    String content
) implements Node {

    @Override
    public String type() {
        return "Effect";
    }
}
