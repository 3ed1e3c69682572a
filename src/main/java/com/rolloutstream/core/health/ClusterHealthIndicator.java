package com.rolloutstream.core.health;

import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.cluster.ClusterGateway;
import com.rolloutstream.core.logs.LogStreamEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the Kubernetes API server.
 * <p>
 * Reports UP with the server version when the API answers, DOWN otherwise.
 * Includes the number of open log streams.
 */
@Component("clusterHealthIndicator")
public class ClusterHealthIndicator implements HealthIndicator {

    private final ClusterGateway clusterGateway;
    private final LogStreamEngine logStreamEngine;

    public ClusterHealthIndicator(ClusterGateway clusterGateway, LogStreamEngine logStreamEngine) {
        this.clusterGateway = clusterGateway;
        this.logStreamEngine = logStreamEngine;
    }

    @Override
    public Health health() {
        int activeStreams = logStreamEngine.activeSessionCount();
        try {
            String version = clusterGateway.checkConnectivity();
            return Health.up()
                    .withDetail("cluster.version", version)
                    .withDetail("streams.active", activeStreams)
                    .build();
        } catch (ClusterAccessException e) {
            return Health.down()
                    .withDetail("cluster.error", e.getMessage())
                    .withDetail("streams.active", activeStreams)
                    .build();
        }
    }
}
