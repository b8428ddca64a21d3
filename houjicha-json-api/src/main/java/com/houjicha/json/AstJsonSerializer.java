package com.houjicha.json;

import com.houjicha.ParseResult;
import com.houjicha.ast.Node;

public interface AstJsonSerializer {

    /**
     * Write one node with its subtree. Every node object starts with its
     * {@code "type"} and {@code "range"}; absent optional children are omitted.
     */
    String serialize(Node node, boolean pretty);

    /**
     * Write a parse result as one object: {@code "file"} when the format names
     * one, {@code "document"} unless the format leaves it out, and always
     * {@code "errors"}.
     */
    String serializeResult(ParseResult result, ResultFormat format);
}
