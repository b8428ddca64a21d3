package com.houjicha.ast;

import java.util.List;

public record Namespace(
    Range range,
    String name,
    List<NamespaceChild> children
) implements DocumentChild {

    public Namespace {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public List<Claim> claims() {
        return children.stream()
            .filter(Claim.class::isInstance)
            .map(Claim.class::cast)
            .toList();
    }

    @Override
    public String type() {
        return "Namespace";
    }
}
