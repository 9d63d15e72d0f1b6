package com.example.nexusmods.codec;

import com.example.nexusmods.model.EndorsementStatus;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Codec for endorsement status. The wire value is an open set, so decoding
 * never fails: only the exact tag {@code "Endorsed"} maps to
 * {@link EndorsementStatus#ENDORSED}, everything else to
 * {@link EndorsementStatus#NOT_ENDORSED}.
 */
public final class EndorsementStatusCodec {

    private EndorsementStatusCodec() {
    }

    public static EndorsementStatus decode(String wireValue) {
        return EndorsementStatus.ENDORSED.wireName().equals(wireValue)
                ? EndorsementStatus.ENDORSED
                : EndorsementStatus.NOT_ENDORSED;
    }

    public static String encode(EndorsementStatus status) {
        return status.wireName();
    }

    public static final class Deserializer extends StdDeserializer<EndorsementStatus> {

        public Deserializer() {
            super(EndorsementStatus.class);
        }

        @Override
        public EndorsementStatus deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_STRING) {
                return decode(p.getText());
            }
            // objects and arrays are consumed whole so the enclosing record keeps parsing
            p.skipChildren();
            return EndorsementStatus.NOT_ENDORSED;
        }

        @Override
        public EndorsementStatus getNullValue(DeserializationContext ctxt) {
            return EndorsementStatus.NOT_ENDORSED;
        }
    }

    public static final class Serializer extends StdSerializer<EndorsementStatus> {

        public Serializer() {
            super(EndorsementStatus.class);
        }

        @Override
        public void serialize(EndorsementStatus value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(encode(value));
        }
    }
}
