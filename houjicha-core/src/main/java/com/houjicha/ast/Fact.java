package com.houjicha.ast;

import java.util.List;

/**
 * Facts applied with {@code <=}. A leaf fact has {@code content}; a compound
 * fact built from {@code (a & b | c)} has {@code operator} and
 * {@code children} and an empty content.
 *
 * <p>A compound fact records a single operator: the last connective in the
 * chain. Only the first {@code @evaluation} of a leaf fact is kept.</p>
 */
public record Fact(
    Range range,
    String content,
    Evaluation evaluation,     // Can be null
    LogicalOperator operator,  // null for leaf facts
    List<Fact> children
) implements Node {

    public Fact {
        content = content == null ? "" : content;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Fact leaf(Range range, String content, Evaluation evaluation) {
        return new Fact(range, content, evaluation, null, List.of());
    }

    public static Fact compound(Range range, LogicalOperator operator, List<Fact> children, Evaluation evaluation) {
        return new Fact(range, "", evaluation, operator, children);
    }

    @Override
    public String type() {
        return "Fact";
    }
}
