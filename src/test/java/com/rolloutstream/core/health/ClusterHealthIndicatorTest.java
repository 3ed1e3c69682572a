package com.rolloutstream.core.health;

import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.cluster.ClusterGateway;
import com.rolloutstream.core.logs.LogStreamEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ClusterHealthIndicatorTest {

    @Test
    @DisplayName("UP with version and stream count")
    void up() {
        ClusterGateway gateway = mock(ClusterGateway.class);
        LogStreamEngine engine = mock(LogStreamEngine.class);
        when(gateway.checkConnectivity()).thenReturn("v1.30.2");
        when(engine.activeSessionCount()).thenReturn(1);

        var health = new ClusterHealthIndicator(gateway, engine).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("v1.30.2", health.getDetails().get("cluster.version"));
        assertEquals(1, health.getDetails().get("streams.active"));
    }

    @Test
    @DisplayName("DOWN with the error when the cluster is unreachable")
    void down() {
        ClusterGateway gateway = mock(ClusterGateway.class);
        when(gateway.checkConnectivity()).thenThrow(new ClusterAccessException("Cluster API unreachable"));

        var health = new ClusterHealthIndicator(gateway, mock(LogStreamEngine.class)).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Cluster API unreachable", health.getDetails().get("cluster.error"));
    }
}
