package com.rolloutstream.core.health;

import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.cluster.ClusterGateway;
import com.rolloutstream.core.logs.LogStreamEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @Test
    @DisplayName("cluster is UP with its version when the API answers")
    void clusterUp() {
        ClusterGateway gateway = mock(ClusterGateway.class);
        when(gateway.checkConnectivity()).thenReturn("v1.30.2");
        var service = new HealthCheckService(gateway, null);

        HealthStatus status = service.checkCluster();

        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("v1.30.2", status.clusterVersion());
        assertNull(status.activeStreams());
    }

    @Test
    @DisplayName("cluster is DOWN when the API is unreachable")
    void clusterDown() {
        ClusterGateway gateway = mock(ClusterGateway.class);
        when(gateway.checkConnectivity()).thenThrow(new ClusterAccessException("Cluster API unreachable"));
        var service = new HealthCheckService(gateway, null);

        HealthStatus status = service.checkCluster();

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("unreachable"));
        assertTrue(status.isDown());
        assertNull(status.clusterVersion());
    }

    @Test
    @DisplayName("reports the number of open streams")
    void streams() {
        LogStreamEngine engine = mock(LogStreamEngine.class);
        when(engine.activeSessionCount()).thenReturn(4);
        var service = new HealthCheckService(null, engine);

        var checks = service.checkAll();

        assertEquals(2, checks.size());
        assertEquals(HealthStatus.Status.DOWN, checks.get(0).status());
        assertEquals(4, checks.get(1).activeStreams());
        assertFalse(checks.get(1).isDown());
    }
}
