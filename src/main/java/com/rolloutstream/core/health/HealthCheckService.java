package com.rolloutstream.core.health;

import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.cluster.ClusterGateway;
import com.rolloutstream.core.logs.LogStreamEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ClusterGateway clusterGateway;
    private final LogStreamEngine logStreamEngine;

    public HealthCheckService(
            @Autowired(required = false) ClusterGateway clusterGateway,
            @Autowired(required = false) LogStreamEngine logStreamEngine) {
        this.clusterGateway = clusterGateway;
        this.logStreamEngine = logStreamEngine;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCluster());
        results.add(checkStreams());
        return results;
    }

    HealthStatus checkCluster() {
        if (clusterGateway == null) {
            return HealthStatus.clusterUnreachable("No cluster client configured");
        }
        try {
            String version = clusterGateway.checkConnectivity();
            return HealthStatus.clusterReachable(version);
        } catch (ClusterAccessException e) {
            log.warn("Cluster health check failed: {}", e.getMessage());
            return HealthStatus.clusterUnreachable("Cluster error: " + e.getMessage());
        }
    }

    HealthStatus checkStreams() {
        if (logStreamEngine == null) {
            return HealthStatus.unavailable(HealthStatus.STREAMS, "Log stream engine not available");
        }
        return HealthStatus.streams(logStreamEngine.activeSessionCount());
    }
}
