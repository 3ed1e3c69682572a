package com.rolloutstream.core.health;

/**
 * Result of one health check.
 *
 * @param clusterVersion API server version, set only by a passing cluster check
 * @param activeStreams  open log streams, set only by the stream check
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    String clusterVersion,
    Integer activeStreams
) {
    public enum Status { UP, DOWN }

    public static final String CLUSTER = "cluster";
    public static final String STREAMS = "streams";

    public static HealthStatus clusterReachable(String version) {
        return new HealthStatus(CLUSTER, Status.UP, "API server reachable", version, null);
    }

    public static HealthStatus clusterUnreachable(String detail) {
        return new HealthStatus(CLUSTER, Status.DOWN, detail, null, null);
    }

    public static HealthStatus streams(int active) {
        return new HealthStatus(STREAMS, Status.UP, active + " active stream(s)", null, active);
    }

    public static HealthStatus unavailable(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, null, null);
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
