package com.houjicha.ast;

public record Comment(
    Range range,
    String text
) implements DocumentChild, NamespaceChild {

    @Override
    public String type() {
        return "Comment";
    }
}
