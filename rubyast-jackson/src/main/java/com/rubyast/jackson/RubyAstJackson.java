package com.rubyast.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = RubyAstJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(classDef);
 * Expression tree = mapper.readValue(json, Expression.class);
 * </pre>
 */
public final class RubyAstJackson {

    private RubyAstJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for tree serialization/deserialization.
     *
     * The returned mapper:
     * - Handles the closed Expression family via the "type" property
     * - Handles literal values via the "kind" property
     * - Writes NameRef, SymbolRef, TypeRef and FileRef handles as integers
     * - Omits null values except for an absent Send block
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Exclude null values by default; Send.block is included via a mixin in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        // EmptyTree and the true/false/nil literal values have no properties besides their type id
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
