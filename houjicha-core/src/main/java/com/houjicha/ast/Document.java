package com.houjicha.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of a parsed houjicha source. {@code constants} holds every constant
 * registered with {@code as} while the document was parsed, in definition order.
 */
public record Document(
    Range range,
    List<DocumentChild> children,
    Map<String, ConstantDefinition> constants
) implements Node {

    public Document {
        children = children == null ? List.of() : List.copyOf(children);
        constants = constants == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(constants));
    }

    /** Claims in source order, including those inside namespaces. */
    public List<Claim> claims() {
        List<Claim> claims = new ArrayList<>();
        for (DocumentChild child : children) {
            if (child instanceof Claim claim) {
                claims.add(claim);
            } else if (child instanceof Namespace namespace) {
                claims.addAll(namespace.claims());
            }
        }
        return List.copyOf(claims);
    }

    @Override
    public String type() {
        return "Document";
    }
}
