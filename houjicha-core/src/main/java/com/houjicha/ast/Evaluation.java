package com.houjicha.ast;

public record Evaluation(
    Range range,
    String content
) implements Node {

    @Override
    public String type() {
        return "Evaluation";
    }
}
