package com.rolloutstream.cluster;

import com.rolloutstream.core.model.ReleaseRef;

import java.util.Optional;

/**
 * Resolves the revision a release currently wants deployed.
 */
public interface ReleaseMetadataSource {

    /**
     * @return the wanted revision token, or empty if the release has no history yet
     * @throws ReleaseNotFoundException if the release does not exist
     * @throws ClusterAccessException   if the lookup fails
     */
    Optional<String> wantedRevision(ReleaseRef release);
}
