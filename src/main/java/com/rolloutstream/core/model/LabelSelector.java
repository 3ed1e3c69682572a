package com.rolloutstream.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Equality-based label selector.
 *
 * @param matchLabels labels a pod must carry, sorted by key
 */
public record LabelSelector(Map<String, String> matchLabels) {

    public static final LabelSelector EMPTY = new LabelSelector(Map.of());

    public LabelSelector {
        matchLabels = matchLabels == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(matchLabels));
    }

    public static LabelSelector of(String key, String value) {
        return new LabelSelector(Map.of(key, value));
    }

    public boolean isEmpty() {
        return matchLabels.isEmpty();
    }

    /**
     * An empty selector matches nothing, mirroring a Deployment without a selector.
     */
    public boolean matches(Map<String, String> labels) {
        if (matchLabels.isEmpty() || labels == null) {
            return false;
        }
        for (var entry : matchLabels.entrySet()) {
            if (!entry.getValue().equals(labels.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /** Renders the selector in the {@code k=v,k2=v2} form the API server accepts. */
    public String toSelectorString() {
        return matchLabels.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }

    @Override
    public String toString() {
        return toSelectorString();
    }
}
