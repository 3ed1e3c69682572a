package com.rolloutstream.dispatch.api;

import com.rolloutstream.core.health.HealthCheckService;
import com.rolloutstream.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @MockitoBean
    private LogStreamSseBridge sseBridge;

    @Test
    @DisplayName("GET /health returns 200 with components when the cluster is reachable")
    void healthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                HealthStatus.clusterReachable("v1.30.2"),
                HealthStatus.streams(2)));
        when(sseBridge.activeStreamCount()).thenReturn(2);

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.connectedClients").value(2))
                .andExpect(jsonPath("$.components.cluster.version").value("v1.30.2"))
                .andExpect(jsonPath("$.components.streams.status").value("UP"))
                .andExpect(jsonPath("$.components.streams.activeStreams").value(2));
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is down")
    void unhealthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                HealthStatus.clusterUnreachable("Cluster error: timeout"),
                HealthStatus.streams(0)));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.cluster.detail").value("Cluster error: timeout"))
                .andExpect(jsonPath("$.components.cluster.version").doesNotExist());
    }
}
