package com.rolloutstream.core.model;

import java.util.Map;

/**
 * A Flux {@code Kustomization} associated with a release.
 *
 * @param namespace     namespace of the kustomization
 * @param name          kustomization name
 * @param substitutions {@code spec.postBuild.substitute} variables
 */
public record Descriptor(
    String namespace,
    String name,
    Map<String, String> substitutions
) {

    public Descriptor {
        substitutions = substitutions == null ? Map.of() : Map.copyOf(substitutions);
    }

    /**
     * Expands {@code ${VAR}} and {@code $(VAR)} references with this descriptor's variables.
     */
    public String substitute(String value) {
        if (value == null || substitutions.isEmpty()) {
            return value;
        }
        String result = value;
        for (var entry : substitutions.entrySet()) {
            result = result.replace("${" + entry.getKey() + "}", entry.getValue());
            result = result.replace("$(" + entry.getKey() + ")", entry.getValue());
        }
        return result;
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
