package com.houjicha.ast;

/**
 * A reason given for an issue's norm. Inside a parenthesized chain every
 * reason after the first records the connective that preceded it.
 */
public record Reason(
    Range range,
    String content,
    LogicalOperator operator  // Can be null
) implements Node {

    @Override
    public String type() {
        return "Reason";
    }
}
