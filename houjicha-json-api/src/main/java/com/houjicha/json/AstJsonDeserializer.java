package com.houjicha.json;

import com.houjicha.ast.Document;
import com.houjicha.ast.Node;

/**
 * Reads nodes written by {@link AstJsonSerializer}. Unknown properties are
 * ignored.
 */
public interface AstJsonDeserializer {

    Document readDocument(String json);

    <T extends Node> T read(String json, Class<T> type);
}
