package com.rolloutstream.core.logs;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Splits a leading ISO-8601 timestamp off a log line.
 * <p>
 * The Kubernetes log API prefixes each line with an RFC 3339 timestamp and a single
 * space when timestamps are requested. Lines without a parseable prefix are kept
 * whole and stamped with the receipt time.
 */
public final class LogLineParser {

    /** Shortest token that can hold a date and time, e.g. {@code 2024-01-01T00:00Z}. */
    private static final int MIN_TIMESTAMP_LENGTH = 17;

    /**
     * @param timestamp the timestamp read from the line, or {@code null} if it had none
     * @param text      the remaining text
     */
    public record ParsedLine(Instant timestamp, String text, long timestampMillis) {

        public boolean hasTimestamp() {
            return timestamp != null;
        }
    }

    public ParsedLine parse(String line, long receivedAtMillis) {
        int space = line.indexOf(' ');
        String token = space < 0 ? line : line.substring(0, space);
        if (token.length() < MIN_TIMESTAMP_LENGTH || !Character.isDigit(token.charAt(0))) {
            return new ParsedLine(null, line, receivedAtMillis);
        }
        Instant timestamp = parseTimestamp(token);
        if (timestamp == null) {
            return new ParsedLine(null, line, receivedAtMillis);
        }
        String text = space < 0 ? "" : line.substring(space + 1);
        return new ParsedLine(timestamp, text, timestamp.toEpochMilli());
    }

    private static Instant parseTimestamp(String token) {
        try {
            return token.endsWith("Z") || token.endsWith("z")
                    ? Instant.parse(token.toUpperCase(Locale.ROOT))
                    : OffsetDateTime.parse(token).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
