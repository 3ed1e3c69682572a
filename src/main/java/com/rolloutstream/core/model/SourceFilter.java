package com.rolloutstream.core.model;

import java.util.Optional;

/**
 * Restricts a subscription to one {@link SourceType}, or admits all of them.
 */
public record SourceFilter(SourceType only) {

    public static final SourceFilter ALL = new SourceFilter(null);

    /**
     * Parses the optional {@code type} request parameter. Blank means all sources.
     */
    public static SourceFilter parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        return new SourceFilter(SourceType.fromWireName(value));
    }

    public boolean admits(SourceType type) {
        return only == null || only == type;
    }

    public Optional<SourceType> restriction() {
        return Optional.ofNullable(only);
    }
}
