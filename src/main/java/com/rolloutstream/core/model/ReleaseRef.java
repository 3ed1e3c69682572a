package com.rolloutstream.core.model;

import java.util.Objects;

/**
 * Identity of a logical release: the kuberik {@code Rollout} whose deployed
 * versions are tracked.
 *
 * @param namespace namespace of the rollout
 * @param name      rollout name
 */
public record ReleaseRef(String namespace, String name) {

    public ReleaseRef {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Parses {@code namespace/name}.
     *
     * @throws IllegalArgumentException if the value is not of that form
     */
    public static ReleaseRef parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Release must be given as namespace/name");
        }
        int slash = value.indexOf('/');
        if (slash <= 0 || slash == value.length() - 1 || value.indexOf('/', slash + 1) >= 0) {
            throw new IllegalArgumentException("Release must be given as namespace/name: " + value);
        }
        return new ReleaseRef(value.substring(0, slash), value.substring(slash + 1));
    }

    public String id() {
        return namespace + "/" + name;
    }

    @Override
    public String toString() {
        return id();
    }
}
