package com.rolloutstream.cluster;

import java.util.Optional;

/**
 * A parsed Flux inventory id of the form {@code <namespace>_<name>_<group>_<kind>}.
 * The group is empty for core resources and the namespace is empty for cluster-scoped ones.
 */
public record InventoryEntryId(String namespace, String name, String group, String kind) {

    public static Optional<InventoryEntryId> parse(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String[] parts = id.split("_", -1);
        if (parts.length != 4 || parts[1].isEmpty() || parts[3].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new InventoryEntryId(parts[0], parts[1], parts[2], parts[3]));
    }

    public String apiVersion(String version) {
        return group.isEmpty() ? version : group + "/" + version;
    }
}
