package com.houjicha.ast;

public record Conclusion(
    Range range,
    boolean positive,
    String content
) implements Node {

    @Override
    public String type() {
        return "Conclusion";
    }
}
