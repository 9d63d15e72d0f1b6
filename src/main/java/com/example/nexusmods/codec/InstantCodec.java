package com.example.nexusmods.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Timestamps arrive either as Unix epoch seconds ({@code *_timestamp},
 * {@code approved_date}) or as ISO-8601 strings with an offset
 * ({@code *_time}, {@code date}). Both decode to {@link Instant}; the
 * serializer picked for a field decides which form is written back.
 */
public final class InstantCodec {

    /** Format the API uses, e.g. {@code 2021-03-04T12:30:00.000+00:00}. */
    public static final DateTimeFormatter ISO_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSxxx");

    private InstantCodec() {
    }

    public static Instant fromEpochSeconds(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds);
    }

    /**
     * Parse an ISO-8601 timestamp with an offset or a trailing {@code Z}.
     *
     * @throws DateTimeParseException if the text is neither
     */
    public static Instant fromIso(String text) {
        return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    public static long toEpochSeconds(Instant instant) {
        return instant.getEpochSecond();
    }

    public static String toIso(Instant instant) {
        return ISO_FORMAT.format(instant.atOffset(ZoneOffset.UTC));
    }

    public static final class Deserializer extends StdDeserializer<Instant> {

        public Deserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT) {
                return fromEpochSeconds(p.getLongValue());
            }
            if (token == JsonToken.VALUE_STRING) {
                String text = p.getText().trim();
                try {
                    return fromIso(text);
                } catch (DateTimeParseException e) {
                    return (Instant) ctxt.handleWeirdStringValue(Instant.class, text,
                            "not an ISO-8601 timestamp: %s", e.getMessage());
                }
            }
            return (Instant) ctxt.handleUnexpectedToken(Instant.class, token, p,
                    "expected epoch seconds or an ISO-8601 string, got %s", token);
        }
    }

    public static final class EpochSecondsSerializer extends StdSerializer<Instant> {

        public EpochSecondsSerializer() {
            super(Instant.class);
        }

        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeNumber(toEpochSeconds(value));
        }
    }

    public static final class IsoSerializer extends StdSerializer<Instant> {

        public IsoSerializer() {
            super(Instant.class);
        }

        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(toIso(value));
        }
    }
}
