package com.rolloutstream.core.model;

import java.util.List;
import java.util.Map;

/**
 * The parts of a pod the log engine needs.
 */
public record ClusterPod(
    String name,
    String namespace,
    Map<String, String> labels,
    List<String> initContainers,
    List<String> containers
) {

    public ClusterPod {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        initContainers = initContainers == null ? List.of() : List.copyOf(initContainers);
        containers = containers == null ? List.of() : List.copyOf(containers);
    }
}
