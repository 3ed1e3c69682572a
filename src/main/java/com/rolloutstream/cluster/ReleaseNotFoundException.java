package com.rolloutstream.cluster;

import com.rolloutstream.core.model.ReleaseRef;

/**
 * Thrown when the rollout behind a release does not exist.
 */
public class ReleaseNotFoundException extends RuntimeException {

    private final ReleaseRef release;

    public ReleaseNotFoundException(ReleaseRef release) {
        super("Rollout not found: " + release.id());
        this.release = release;
    }

    public ReleaseRef release() {
        return release;
    }
}
