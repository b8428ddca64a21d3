package com.houjicha.json;

import java.util.ServiceLoader;

/**
 * A JSON binding for houjicha parse results.
 *
 * <p>Bindings register themselves in
 * {@code META-INF/services/com.houjicha.json.AstJsonProvider}. {@link #load()}
 * takes the first binding on the class path and {@link #load(String)} selects
 * one by name, which is how {@code HoujichaDump --json=NAME} resolves its
 * output format.</p>
 */
public interface AstJsonProvider {

    /** Short name used for lookup, compared ignoring case. */
    String name();

    AstJsonSerializer serializer();

    AstJsonDeserializer deserializer();

    static AstJsonProvider load() {
        return ServiceLoader.load(AstJsonProvider.class)
            .findFirst()
            .orElseThrow(() -> new AstJsonException("No JSON binding on the class path"));
    }

    static AstJsonProvider load(String name) {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(provider -> provider.name().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new AstJsonException("No JSON binding named '" + name + "'"));
    }
}
