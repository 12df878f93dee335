package org.netpreserve.pdfharvest.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads a bare number as milliseconds, or a string such as "500ms", "30s" or "2m".
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim().toLowerCase(Locale.ROOT);
        try {
            if (text.endsWith("ms")) return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            if (text.chars().allMatch(Character::isDigit)) return Duration.ofMillis(Long.parseLong(text));
            if (text.startsWith("pt")) return Duration.parse(text.toUpperCase(Locale.ROOT));
            return Duration.parse("PT" + text.toUpperCase(Locale.ROOT));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new InvalidFormatException(jsonParser, "Invalid duration: " + text, text, Duration.class);
        }
    }
}
