package org.lexcrawl.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads durations written as plain milliseconds, as {@code 30s}/{@code 5m}/{@code 1h30m}, or as {@code 2d}.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isNumeric()) return Duration.ofMillis(parser.getLongValue());
        return parse(parser.getText());
    }

    public static Duration parse(String text) {
        String value = text.trim().toUpperCase(Locale.ROOT);
        try {
            if (value.endsWith("MS")) {
                return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
            }
            if (value.endsWith("D") && value.indexOf('H') < 0 && value.indexOf('M') < 0 && value.indexOf('S') < 0) {
                return Duration.parse("P" + value);
            }
            return Duration.parse("PT" + value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration: " + text, e);
        }
    }
}
