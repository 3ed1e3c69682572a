package com.rolloutstream.core.model;

/**
 * One entry of the pod roster broadcast in {@code pods} events.
 */
public record PodInfo(
    String name,
    String namespace,
    SourceType type
) {}
