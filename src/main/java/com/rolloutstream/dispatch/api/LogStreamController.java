package com.rolloutstream.dispatch.api;

import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.cluster.ReleaseNotFoundException;
import com.rolloutstream.core.logs.LogStreamEngine;
import com.rolloutstream.core.logs.LogStreamSession;
import com.rolloutstream.core.model.ReleaseRef;
import com.rolloutstream.core.model.SourceFilter;
import com.rolloutstream.core.model.SourceType;
import com.rolloutstream.core.model.StreamSubscription;
import com.rolloutstream.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for rollout log streaming.
 */
@RestController
@RequestMapping("/api/v1/rollouts")
public class LogStreamController {

    private static final Logger log = LoggerFactory.getLogger(LogStreamController.class);

    private final LogStreamEngine logStreamEngine;
    private final LogStreamSseBridge sseBridge;

    public LogStreamController(LogStreamEngine logStreamEngine, LogStreamSseBridge sseBridge) {
        this.logStreamEngine = logStreamEngine;
        this.sseBridge = sseBridge;
    }

    /**
     * GET /api/v1/rollouts/{namespace}/{name}/pods/logs: SSE stream of the release's logs.
     * <p>
     * {@code type} restricts to {@code workload} or {@code job} pods, {@code since} (epoch millis)
     * resumes after a reconnect. With {@code pod} set only that pod is followed, optionally
     * restricted to {@code container}.
     */
    @GetMapping("/{namespace}/{name}/pods/logs")
    public ResponseEntity<SseEmitter> streamLogs(
            @PathVariable String namespace,
            @PathVariable String name,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Long since,
            @RequestParam(required = false) String pod,
            @RequestParam(required = false) String container) {
        SourceFilter filter = SourceFilter.parse(type);
        Instant sinceTime = since != null && since > 0 ? Instant.ofEpochMilli(since) : null;

        if (pod != null && !pod.isBlank()) {
            SourceType podType = filter.restriction().orElse(SourceType.WORKLOAD);
            LogStreamSession session = logStreamEngine.openSinglePod(namespace, pod, container, podType, sinceTime);
            return ResponseEntity.ok(sseBridge.attach(session));
        }

        ReleaseRef release = new ReleaseRef(namespace, name);
        try {
            LogStreamSession session = logStreamEngine.open(new StreamSubscription(release, filter, sinceTime));
            return ResponseEntity.ok(sseBridge.attach(session));
        } catch (ReleaseNotFoundException e) {
            log.info("Log stream requested for unknown rollout {}", release);
            return ResponseEntity.ok(sseBridge.error(e.getMessage()));
        }
    }

    /**
     * GET /api/v1/rollouts/{namespace}/{name}/log-targets: Targets the release currently resolves to.
     */
    @GetMapping("/{namespace}/{name}/log-targets")
    public ResponseEntity<List<Map<String, Object>>> logTargets(
            @PathVariable String namespace,
            @PathVariable String name,
            @RequestParam(required = false) String type) {
        SourceFilter filter = SourceFilter.parse(type);
        List<Target> targets = logStreamEngine.resolveTargets(new ReleaseRef(namespace, name), filter);
        return ResponseEntity.ok(targets.stream().map(LogStreamController::toMap).toList());
    }

    private static Map<String, Object> toMap(Target target) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", target.id());
        result.put("namespace", target.namespace());
        result.put("selector", target.selector().toSelectorString());
        result.put("type", target.kind().wireName());
        return result;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ReleaseNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ReleaseNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ClusterAccessException.class)
    public ResponseEntity<Map<String, String>> clusterUnavailable(ClusterAccessException e) {
        log.warn("Cluster request failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }
}
