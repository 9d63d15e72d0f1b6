package com.example.nexusmods.codec;

import com.example.nexusmods.model.ParentCategory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Codec for {@code parent_category}: a non-negative integer, or {@code false}
 * for top-level categories. {@code true}, negative numbers, null and any other
 * shape are rejected because the set of wire shapes is closed.
 */
public final class ParentCategoryCodec {

    private ParentCategoryCodec() {
    }

    public static final class Deserializer extends StdDeserializer<ParentCategory> {

        public Deserializer() {
            super(ParentCategory.class);
        }

        @Override
        public ParentCategory deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_FALSE) {
                return ParentCategory.none();
            }
            if (token == JsonToken.VALUE_NUMBER_INT) {
                long id = p.getLongValue();
                if (id < 0 || id > Integer.MAX_VALUE) {
                    return (ParentCategory) ctxt.handleWeirdNumberValue(ParentCategory.class, p.getNumberValue(),
                            "parent category id must be a non-negative int");
                }
                return ParentCategory.of((int) id);
            }
            return (ParentCategory) ctxt.handleUnexpectedToken(ParentCategory.class, token, p,
                    "expected a category id or false for parent_category, got %s", token);
        }

        @Override
        public ParentCategory getNullValue(DeserializationContext ctxt) throws JsonMappingException {
            return ctxt.reportInputMismatch(ParentCategory.class,
                    "null is not a valid parent_category, expected a category id or false");
        }
    }

    public static final class Serializer extends StdSerializer<ParentCategory> {

        public Serializer() {
            super(ParentCategory.class);
        }

        @Override
        public void serialize(ParentCategory value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value instanceof ParentCategory.Parent parent) {
                gen.writeNumber(parent.categoryId());
            } else {
                gen.writeBoolean(false);
            }
        }
    }
}
