package com.rolloutstream.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single parsed log line. Serialized as {@code {pod, container, type, line, timestamp}}.
 *
 * @param pod             pod the line came from
 * @param container       container the line came from
 * @param sourceType      kind of the target the pod was discovered through
 * @param text            line text with any leading timestamp removed
 * @param timestampMillis timestamp from the line, or receipt time when it had none
 */
public record LogEvent(
    String pod,
    String container,
    @JsonProperty("type") SourceType sourceType,
    @JsonProperty("line") String text,
    @JsonProperty("timestamp") long timestampMillis
) {

    @JsonIgnore
    public StreamKey streamKey() {
        return new StreamKey(pod, container);
    }
}
