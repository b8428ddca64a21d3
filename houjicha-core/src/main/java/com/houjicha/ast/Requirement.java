package com.houjicha.ast;

import java.util.List;

/**
 * One legal element of a claim. Built from {@code (name)}, from a bare norm
 * ({@code %...} / {@code $...}) in which case {@code name} mirrors the norm's
 * content, or from an issue ({@code ?...}) in which case {@code name} is the
 * question.
 */
public record Requirement(
    Range range,
    Concluded concluded,
    String name,
    Norm norm,    // Can be null
    Fact fact,    // Can be null
    List<Requirement> subRequirements,
    Issue issue,  // Can be null
    List<ReasonStatement> reasonStatements
) implements Node {

    public Requirement {
        concluded = concluded == null ? Concluded.NONE : concluded;
        subRequirements = subRequirements == null ? List.of() : List.copyOf(subRequirements);
        reasonStatements = reasonStatements == null ? List.of() : List.copyOf(reasonStatements);
    }

    @Override
    public String type() {
        return "Requirement";
    }
}
