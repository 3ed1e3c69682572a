package com.rolloutstream.core.logs;

import com.rolloutstream.core.model.SourceType;
import com.rolloutstream.core.model.StreamKey;

import java.time.Instant;

/**
 * What a {@link ContainerTailer} should follow.
 *
 * @param releaseId  release the stream belongs to, for logging context
 * @param targetId   target that discovered the pod
 * @param namespace  pod namespace
 * @param key        pod and container
 * @param sourceType type stamped on every event
 * @param sinceTime  resume point (nullable); lines before it are not delivered
 * @param resumed    {@code true} when {@code sinceTime} is the timestamp of a line this
 *                   stream already delivered, which is then skipped as well
 */
public record TailRequest(
    String releaseId,
    String targetId,
    String namespace,
    StreamKey key,
    SourceType sourceType,
    Instant sinceTime,
    boolean resumed
) {}
