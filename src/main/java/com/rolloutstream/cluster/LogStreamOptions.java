package com.rolloutstream.cluster;

import java.time.Instant;
import java.util.OptionalInt;

/**
 * Options for following a container's log. Lines always carry their RFC 3339 timestamp.
 *
 * @param sinceTime only return lines written at or after this instant (nullable)
 * @param tailLines number of trailing lines to start with; ignored when {@code sinceTime} is set,
 *                  non-positive means no limit
 */
public record LogStreamOptions(
    Instant sinceTime,
    int tailLines
) {

    public static LogStreamOptions follow(Instant sinceTime, int tailLines) {
        return new LogStreamOptions(sinceTime, tailLines);
    }

    /** The tail limit to send, empty when reading from {@code sinceTime} or without a limit. */
    public OptionalInt tailLimit() {
        return sinceTime == null && tailLines > 0 ? OptionalInt.of(tailLines) : OptionalInt.empty();
    }
}
