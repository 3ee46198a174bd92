package io.chatsync.json.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Reads the timestamp shapes a Postgres-backed REST layer produces.
 *
 * <p>Accepted: ISO-8601 date-times with offset ({@code 2025-03-01T10:00:00.123456+00:00}), instants
 * ({@code ...Z}), the Postgres text form ({@code 2025-03-01 10:00:00+00}), zone-less local
 * date-times (read as UTC) and epoch milliseconds.
 */
final class FlexibleInstantDeserializer extends StdScalarDeserializer<Instant> {

    private static final Pattern SHORT_OFFSET = Pattern.compile("T.*[+-]\\d{2}$");

    FlexibleInstantDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return Instant.ofEpochMilli(p.getLongValue());
        }
        if (token == JsonToken.VALUE_STRING) {
            String text = p.getText();
            Instant parsed = parse(text);
            if (parsed == null) {
                return (Instant) ctxt.handleWeirdStringValue(Instant.class, text, "not an ISO-8601 timestamp");
            }
            return parsed;
        }
        return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
    }

    static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String normalized = raw.trim().replace(' ', 'T');
        String text = SHORT_OFFSET.matcher(normalized).find() ? normalized + ":00" : normalized;

        Instant parsed = attempt(() -> OffsetDateTime.parse(text).toInstant());
        if (parsed == null) parsed = attempt(() -> Instant.parse(text));
        if (parsed == null) parsed = attempt(() -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        return parsed;
    }

    private static Instant attempt(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
