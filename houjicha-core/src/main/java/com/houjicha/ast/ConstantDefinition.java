package com.houjicha.ast;

/**
 * Entry of the constants table: the norm registered under {@code name},
 * captured when its {@code as} clause was parsed.
 */
public record ConstantDefinition(
    Range range,
    String name,
    Norm value
) implements Node {

    @Override
    public String type() {
        return "ConstantDefinition";
    }
}
