package com.rolloutstream.core.logs;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "rollout-stream")
public class LogStreamProperties {

    private Stream stream = new Stream();
    private Sse sse = new Sse();
    private Cluster cluster = new Cluster();

    // -- Stream accessors (delegate to nested) --
    public int getBufferCapacity() { return stream.bufferCapacity; }
    public Duration getDiscoveryInterval() { return stream.discoveryInterval; }
    public Duration getPodSyncInterval() { return stream.podSyncInterval; }
    public Duration getRosterInterval() { return stream.rosterInterval; }
    public int getInitialTailLines() { return stream.initialTailLines; }
    public Duration getShutdownTimeout() { return stream.shutdownTimeout; }
    public int getTimerThreads() { return stream.timerThreads; }

    // -- SSE accessors (delegate to nested) --
    public Duration getKeepaliveInterval() { return sse.keepaliveInterval; }
    public Duration getEmitterTimeout() { return sse.emitterTimeout; }

    // -- Cluster accessors (delegate to nested) --
    public String getClusterContext() { return cluster.context; }
    public Duration getClusterRequestTimeout() { return cluster.requestTimeout; }

    public Stream getStream() { return stream; }
    public void setStream(Stream stream) { this.stream = stream; }
    public Sse getSse() { return sse; }
    public void setSse(Sse sse) { this.sse = sse; }
    public Cluster getCluster() { return cluster; }
    public void setCluster(Cluster cluster) { this.cluster = cluster; }

    public static class Stream {
        private int bufferCapacity = 1000;
        private Duration discoveryInterval = Duration.ofSeconds(5);
        private Duration podSyncInterval = Duration.ofSeconds(2);
        private Duration rosterInterval = Duration.ofSeconds(2);
        private int initialTailLines = 100;
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private int timerThreads = 4;

        public int getBufferCapacity() { return bufferCapacity; }
        public void setBufferCapacity(int bufferCapacity) { this.bufferCapacity = bufferCapacity; }
        public Duration getDiscoveryInterval() { return discoveryInterval; }
        public void setDiscoveryInterval(Duration discoveryInterval) { this.discoveryInterval = discoveryInterval; }
        public Duration getPodSyncInterval() { return podSyncInterval; }
        public void setPodSyncInterval(Duration podSyncInterval) { this.podSyncInterval = podSyncInterval; }
        public Duration getRosterInterval() { return rosterInterval; }
        public void setRosterInterval(Duration rosterInterval) { this.rosterInterval = rosterInterval; }
        public int getInitialTailLines() { return initialTailLines; }
        public void setInitialTailLines(int initialTailLines) { this.initialTailLines = initialTailLines; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
        public int getTimerThreads() { return timerThreads; }
        public void setTimerThreads(int timerThreads) { this.timerThreads = timerThreads; }
    }

    public static class Sse {
        /** Proxies in front of the service drop idle connections; keepalives go out at this rate. */
        private Duration keepaliveInterval = Duration.ofSeconds(15);
        private Duration emitterTimeout = Duration.ofMinutes(30);

        public Duration getKeepaliveInterval() { return keepaliveInterval; }
        public void setKeepaliveInterval(Duration keepaliveInterval) { this.keepaliveInterval = keepaliveInterval; }
        public Duration getEmitterTimeout() { return emitterTimeout; }
        public void setEmitterTimeout(Duration emitterTimeout) { this.emitterTimeout = emitterTimeout; }
    }

    public static class Cluster {
        /** Kubeconfig context to use; the current context (or in-cluster config) when unset. */
        private String context;
        private Duration requestTimeout = Duration.ofSeconds(10);

        public String getContext() { return context; }
        public void setContext(String context) { this.context = context; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }
}
