package com.houjicha.ast;

import java.util.List;

/**
 * An interpretive rule, {@code %content}. A norm written {@code %X as C}
 * carries {@code constantDefinition = "C"}; a norm expanded from {@code $C}
 * carries {@code constantReference = "C"} and a copy of the constant's
 * content and reference as they were when it was used.
 */
public record Norm(
    Range range,
    Concluded concluded,
    String content,
    Reference reference,  // Can be null
    Norm subNorm,         // Can be null
    Fact fact,            // Can be null
    List<Requirement> subRequirements,
    String constantDefinition,  // Can be null
    String constantReference    // Can be null
) implements Node {

    public Norm {
        concluded = concluded == null ? Concluded.NONE : concluded;
        content = content == null ? "" : content;
        subRequirements = subRequirements == null ? List.of() : List.copyOf(subRequirements);
    }

    public Norm withFact(Fact newFact) {
        return new Norm(range, concluded, content, reference, subNorm, newFact,
                        subRequirements, constantDefinition, constantReference);
    }

    public Norm withSubRequirements(List<Requirement> newSubRequirements) {
        return new Norm(range, concluded, content, reference, subNorm, fact,
                        newSubRequirements, constantDefinition, constantReference);
    }

    @Override
    public String type() {
        return "Norm";
    }
}
