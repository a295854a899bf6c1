package com.rubyast.json;

import com.rubyast.ast.Expression;

/**
 * Writes trees as JSON. Every node object carries a {@code "type"} property naming its
 * variant; name, symbol, type and file handles are written as plain integers.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a tree to a compact JSON string.
     *
     * @param tree the tree to serialize
     * @return the JSON representation of the tree
     * @throws AstJsonException if serialization fails
     */
    String serialize(Expression tree) throws AstJsonException;

    /**
     * Serializes a tree to an indented JSON string.
     *
     * @param tree the tree to serialize
     * @return the pretty-printed JSON representation of the tree
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Expression tree) throws AstJsonException;
}
