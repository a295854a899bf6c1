package com.rubyast.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.function.IntFunction;
import java.util.function.ToIntFunction;

/**
 * Handles such as {@code NameRef} are single-int records; they are written as a bare
 * JSON number instead of {@code {"id": n}}.
 */
final class RefSerializers {

    private RefSerializers() {
    }

    static final class IntHandleSerializer<T> extends JsonSerializer<T> {
        private final Class<T> type;
        private final ToIntFunction<T> toId;

        IntHandleSerializer(Class<T> type, ToIntFunction<T> toId) {
            this.type = type;
            this.toId = toId;
        }

        @Override
        public Class<T> handledType() {
            return type;
        }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeNumber(toId.applyAsInt(value));
        }
    }

    static final class IntHandleDeserializer<T> extends JsonDeserializer<T> {
        private final Class<T> type;
        private final IntFunction<T> fromId;

        IntHandleDeserializer(Class<T> type, IntFunction<T> fromId) {
            this.type = type;
            this.fromId = fromId;
        }

        @Override
        public Class<?> handledType() {
            return type;
        }

        @Override
        public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.VALUE_NUMBER_INT) {
                return type.cast(ctxt.handleUnexpectedToken(type, p));
            }
            return fromId.apply(p.getIntValue());
        }
    }
}
