package com.houjicha;

import com.houjicha.ast.ConstantDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Constants registered with {@code as} during a single parse.
 *
 * <p>Entries are only ever added, in source order, and a later definition of
 * the same name replaces the earlier one. A {@code $name} lookup sees exactly
 * the definitions parsed before it; there is no forward resolution.</p>
 */
public final class ConstantTable {
    private static final Logger LOG = LoggerFactory.getLogger(ConstantTable.class);

    private final Map<String, ConstantDefinition> definitions = new LinkedHashMap<>();

    public void define(ConstantDefinition definition) {
        ConstantDefinition previous = definitions.put(definition.name(), definition);
        if (previous != null) {
            LOG.debug("Constant '{}' redefined at line {}", definition.name(),
                      definition.range().start().line() + 1);
        } else {
            LOG.debug("Constant '{}' defined at line {}", definition.name(),
                      definition.range().start().line() + 1);
        }
    }

    public Optional<ConstantDefinition> lookup(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public int size() {
        return definitions.size();
    }

    public Map<String, ConstantDefinition> asMap() {
        return Collections.unmodifiableMap(definitions);
    }
}
