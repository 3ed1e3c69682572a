package com.rolloutstream.core.model;

import java.util.List;
import java.util.Map;

/**
 * One generation of a workload: a ReplicaSet created for a Deployment template.
 */
public record WorkloadGeneration(
    String name,
    String namespace,
    Map<String, String> labels,
    Map<String, String> annotations,
    List<OwnerRef> ownerReferences,
    List<String> images
) {

    public WorkloadGeneration {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        ownerReferences = ownerReferences == null ? List.of() : List.copyOf(ownerReferences);
        images = images == null ? List.of() : List.copyOf(images);
    }

    public boolean isOwnedBy(String kind, String name) {
        return ownerReferences.stream().anyMatch(ref -> ref.kind().equals(kind) && ref.name().equals(name));
    }

    public record OwnerRef(String kind, String name) {}
}
