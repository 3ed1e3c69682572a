package com.rolloutstream.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of workload a log source belongs to.
 * <p>
 * WORKLOAD: pods of a Deployment revision.
 * JOB: pods of a test Job run against the release.
 */
public enum SourceType {
    WORKLOAD("workload"),
    JOB("job");

    private final String wireName;

    SourceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name. The older names {@code pod} and {@code test} are accepted too.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SourceType fromWireName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "workload", "pod" -> WORKLOAD;
            case "job", "test" -> JOB;
            default -> throw new IllegalArgumentException("Unknown source type: " + value);
        };
    }
}
