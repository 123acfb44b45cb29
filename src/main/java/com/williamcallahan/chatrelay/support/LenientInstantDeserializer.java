package com.williamcallahan.chatrelay.support;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * Reads timestamps written either as ISO instants, offset date-times, zone-less local date-times
 * (interpreted in the system zone) or epoch seconds. Numbers are always seconds, integral or fractional,
 * matching Unix timestamps written by the previous deployment.
 *
 * <p>Older snapshot files carry local date-times without an offset, so strict {@link Instant} parsing
 * would reject them.</p>
 */
public class LenientInstantDeserializer extends StdDeserializer<Instant> {

    private final ZoneId fallbackZone;

    public LenientInstantDeserializer() {
        this(ZoneId.systemDefault());
    }

    public LenientInstantDeserializer(ZoneId fallbackZone) {
        super(Instant.class);
        this.fallbackZone = fallbackZone;
    }

    @Override
    public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return Instant.ofEpochSecond(parser.getLongValue());
        }
        if (token == JsonToken.VALUE_NUMBER_FLOAT) {
            return fromEpochSeconds(parser.getDecimalValue());
        }
        String text = parser.getValueAsString();
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return parse(text.trim());
        } catch (DateTimeException parseFailure) {
            return (Instant) context.handleWeirdStringValue(Instant.class, text, "Unrecognized timestamp format");
        }
    }

    static Instant fromEpochSeconds(BigDecimal epochSeconds) {
        long seconds = epochSeconds.longValue();
        long nanos = epochSeconds.subtract(BigDecimal.valueOf(seconds)).movePointRight(9).longValue();
        return Instant.ofEpochSecond(seconds, nanos);
    }

    /**
     * Parses a timestamp string in any of the accepted formats.
     *
     * @param text trimmed timestamp text
     * @return parsed instant
     * @throws DateTimeException when no format matches
     */
    public Instant parse(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeException notInstant) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeException notOffset) {
                return LocalDateTime.parse(text).atZone(fallbackZone).toInstant();
            }
        }
    }
}
