package com.houjicha.ast;

import java.util.List;

/**
 * An open interpretive question, {@code ?question ~> reasons => %norm}.
 */
public record Issue(
    Range range,
    String question,
    List<Reason> reasons,
    Norm norm,
    Conclusion conclusion  // Can be null
) implements Node {

    public Issue {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    @Override
    public String type() {
        return "Issue";
    }
}
