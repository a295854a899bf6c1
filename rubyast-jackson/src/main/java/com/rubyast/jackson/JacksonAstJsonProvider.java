package com.rubyast.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rubyast.ast.Expression;
import com.rubyast.json.AstJsonDeserializer;
import com.rubyast.json.AstJsonException;
import com.rubyast.json.AstJsonProvider;
import com.rubyast.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = RubyAstJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Expression tree) throws AstJsonException {
            try {
                return mapper.writeValueAsString(tree);
            } catch (Exception e) {
                throw new AstJsonException(tree.type(), "Failed to serialize " + tree.type(), e);
            }
        }

        @Override
        public String serializePretty(Expression tree) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
            } catch (Exception e) {
                throw new AstJsonException(tree.type(), "Failed to serialize " + tree.type(), e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Expression deserialize(String json) throws AstJsonException {
            return deserialize(json, Expression.class);
        }

        @Override
        public <T extends Expression> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new AstJsonException(type.getSimpleName(), "Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
