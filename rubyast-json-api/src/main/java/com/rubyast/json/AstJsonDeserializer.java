package com.rubyast.json;

import com.rubyast.ast.Expression;

/**
 * Reads trees written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a tree whose root may be any variant.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized tree
     * @throws AstJsonException if the input is malformed or violates a node invariant
     */
    Expression deserialize(String json) throws AstJsonException;

    /**
     * Deserializes a tree whose root is expected to be a {@code T}.
     *
     * @param json the JSON string to deserialize
     * @param type the expected root variant
     * @param <T> the root variant
     * @return the deserialized tree
     * @throws AstJsonException if deserialization fails
     */
    <T extends Expression> T deserialize(String json, Class<T> type) throws AstJsonException;
}
