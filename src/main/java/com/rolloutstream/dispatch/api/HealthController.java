package com.rolloutstream.dispatch.api;

import com.rolloutstream.core.health.HealthCheckService;
import com.rolloutstream.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for cluster connectivity and stream status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;
    private final LogStreamSseBridge sseBridge;

    public HealthController(HealthCheckService healthCheckService, LogStreamSseBridge sseBridge) {
        this.healthCheckService = healthCheckService;
        this.sseBridge = sseBridge;
    }

    /**
     * GET /api/v1/health: 200 while the cluster is reachable, 503 otherwise.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService.checkAll();
        boolean down = checks.stream().anyMatch(HealthStatus::isDown);

        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("status", check.status().name());
            info.put("detail", check.detail());
            if (check.clusterVersion() != null) {
                info.put("version", check.clusterVersion());
            }
            if (check.activeStreams() != null) {
                info.put("activeStreams", check.activeStreams());
            }
            components.put(check.component(), info);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", down ? "DOWN" : "UP");
        result.put("connectedClients", sseBridge.activeStreamCount());
        result.put("components", components);
        return down ? ResponseEntity.status(503).body(result) : ResponseEntity.ok(result);
    }
}
