package com.rolloutstream.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An object recorded in a descriptor's inventory.
 *
 * @param apiVersion API version, e.g. {@code apps/v1}
 * @param kind       resource kind
 * @param namespace  namespace of the object
 * @param name       object name
 * @param object     the live object, or {@code null} if it could not be fetched
 */
public record ManagedResource(
    String apiVersion,
    String kind,
    String namespace,
    String name,
    JsonNode object
) {

    public boolean isKind(String group, String expectedKind) {
        if (!expectedKind.equals(kind)) {
            return false;
        }
        String resourceGroup = apiVersion == null || !apiVersion.contains("/")
                ? ""
                : apiVersion.substring(0, apiVersion.indexOf('/'));
        return group.equals(resourceGroup);
    }

    public boolean isPresent() {
        return object != null && !object.isMissingNode() && !object.isNull();
    }
}
