package com.rolloutstream.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LogStreamMetricsTest {

    private SimpleMeterRegistry registry;
    private LogStreamMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LogStreamMetrics(registry);
    }

    @Test
    @DisplayName("recordDropped counts by event type")
    void recordDropped() {
        metrics.recordDropped("log");
        metrics.recordDropped("log");
        metrics.recordDropped("pods");

        assertEquals(2.0, registry.find("rolloutstream.events.dropped").tag("event", "log").counter().count());
        assertEquals(1.0, registry.find("rolloutstream.events.dropped").tag("event", "pods").counter().count());
    }

    @Test
    @DisplayName("tailer lifecycle counters track outcomes and lines")
    void tailerLifecycle() {
        metrics.recordTailerStarted("workload");
        metrics.recordTailerFinished("ended", 12);
        metrics.recordTailerFinished("cancelled", 3);

        assertEquals(1.0, registry.find("rolloutstream.tailers.started").tag("source", "workload").counter().count());
        assertEquals(1.0, registry.find("rolloutstream.tailers.finished").tag("outcome", "ended").counter().count());
        assertEquals(15.0, registry.find("rolloutstream.lines.read").counter().count());
    }

    @Test
    @DisplayName("recordResolution records duration and target count")
    void recordResolution() {
        metrics.recordResolution(120, 3);

        var timer = registry.find("rolloutstream.resolution.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(3.0, registry.find("rolloutstream.resolution.targets").summary().totalAmount());
    }

    @Test
    @DisplayName("discovery failures are tagged by stage")
    void discoveryFailures() {
        metrics.recordDiscoveryFailure("pods");

        assertEquals(1.0, registry.find("rolloutstream.discovery.failures").tag("stage", "pods").counter().count());
    }

    @Test
    @DisplayName("active sessions gauge follows its supplier")
    void activeSessionsGauge() {
        var active = new AtomicInteger(2);
        metrics.registerActiveSessions(active::get);
        active.set(5);

        assertEquals(5.0, registry.find("rolloutstream.sessions.active").gauge().value());
    }
}
