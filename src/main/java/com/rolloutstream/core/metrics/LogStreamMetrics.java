package com.rolloutstream.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for log streaming.
 */
@Service
public class LogStreamMetrics {

    private final MeterRegistry registry;

    public LogStreamMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDropped(String eventType) {
        Counter.builder("rolloutstream.events.dropped")
                .description("Messages discarded because the stream buffer was full")
                .tag("event", eventType)
                .register(registry)
                .increment();
    }

    public void recordTailerStarted(String sourceType) {
        Counter.builder("rolloutstream.tailers.started")
                .tag("source", sourceType)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "ended", "cancelled", "open_failed" or "error"
     */
    public void recordTailerFinished(String outcome, long lines) {
        Counter.builder("rolloutstream.tailers.finished")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Counter.builder("rolloutstream.lines.read")
                .register(registry)
                .increment(lines);
    }

    /**
     * @param stage "release", "descriptor" or "pods"
     */
    public void recordDiscoveryFailure(String stage) {
        Counter.builder("rolloutstream.discovery.failures")
                .description("Cluster queries that failed and were retried on the next tick")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordResolution(long ms, int targetCount) {
        Timer.builder("rolloutstream.resolution.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        registry.summary("rolloutstream.resolution.targets").record(targetCount);
    }

    public void registerActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder("rolloutstream.sessions.active", activeSessions)
                .description("Open log stream subscriptions")
                .register(registry);
    }
}
