package com.rolloutstream.core.model;

import java.time.Instant;

/**
 * A long-lived request to follow the logs of one release.
 *
 * @param release release to follow
 * @param filter  source types to include
 * @param since   optional point in time to resume from (nullable)
 */
public record StreamSubscription(
    ReleaseRef release,
    SourceFilter filter,
    Instant since
) {

    public StreamSubscription {
        if (filter == null) {
            filter = SourceFilter.ALL;
        }
    }
}
