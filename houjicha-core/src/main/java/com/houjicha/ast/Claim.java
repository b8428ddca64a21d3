package com.houjicha.ast;

import java.util.List;

/**
 * A legal assertion under examination, e.g. {@code +#窃盗罪^刑法235条 <= 甲の行為:}.
 */
public record Claim(
    Range range,
    Concluded concluded,
    String name,
    Reference reference,  // Can be null
    Fact fact,            // Can be null
    List<Requirement> requirements,
    Effect effect,        // Can be null
    List<ReasonStatement> reasonStatements
) implements DocumentChild, NamespaceChild {

    public Claim {
        concluded = concluded == null ? Concluded.NONE : concluded;
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        reasonStatements = reasonStatements == null ? List.of() : List.copyOf(reasonStatements);
    }

    @Override
    public String type() {
        return "Claim";
    }
}
