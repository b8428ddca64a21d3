package com.houjicha.ast;

/**
 * Citation of the governing provision, the free text after {@code ^}.
 */
public record Reference(
    Range range,
    String citation
) implements Node {

    @Override
    public String type() {
        return "Reference";
    }
}
