package com.rolloutstream.core.logs;

import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.cluster.ClusterGateway;
import com.rolloutstream.cluster.LogStream;
import com.rolloutstream.cluster.LogStreamOptions;
import com.rolloutstream.core.logging.MdcContext;
import com.rolloutstream.core.metrics.LogStreamMetrics;
import com.rolloutstream.core.model.LogEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;

/**
 * Follows one container's log and pushes each line to the multiplexer.
 *
 * <p>A fresh stream starts from the last {@code initialTailLines} lines; a resumed one
 * starts at its {@code sinceTime} with no tail limit. The method returns when the handle is
 * cancelled or the stream ends, which happens when the pod terminates. Neither case is an error.
 * A stream that cannot be opened returns at once without emitting anything.
 */
public class ContainerTailer {

    private static final Logger log = LoggerFactory.getLogger(ContainerTailer.class);

    private final ClusterGateway gateway;
    private final LogLineParser parser;
    private final int initialTailLines;
    private final Clock clock;
    private final LogStreamMetrics metrics;

    public ContainerTailer(ClusterGateway gateway, int initialTailLines, LogStreamMetrics metrics) {
        this(gateway, new LogLineParser(), initialTailLines, Clock.systemUTC(), metrics);
    }

    ContainerTailer(ClusterGateway gateway, LogLineParser parser, int initialTailLines, Clock clock,
                    LogStreamMetrics metrics) {
        this.gateway = gateway;
        this.parser = parser;
        this.initialTailLines = initialTailLines;
        this.clock = clock;
        this.metrics = metrics;
    }

    public void run(TailRequest request, EventMultiplexer sink, TailHandle handle) {
        MdcContext.setStream(request.releaseId(), request.targetId(), request.key().toString());
        try {
            if (handle.isCancelled()) {
                return;
            }
            follow(request, sink, handle);
        } finally {
            handle.markDone();
            MdcContext.clear();
        }
    }

    private void follow(TailRequest request, EventMultiplexer sink, TailHandle handle) {
        var key = request.key();
        Instant since = request.sinceTime();
        LogStream stream;
        try {
            stream = gateway.streamContainerLogs(request.namespace(), key.pod(), key.container(),
                    LogStreamOptions.follow(since, since == null ? initialTailLines : 0));
        } catch (ClusterAccessException e) {
            log.debug("Could not open log stream for {}: {}", key, e.getMessage());
            recordFinished("open_failed", 0);
            return;
        }
        if (!handle.attach(stream)) {
            recordFinished("cancelled", 0);
            return;
        }

        log.debug("Following {} (since: {})", key, since);
        if (metrics != null) {
            metrics.recordTailerStarted(request.sourceType().wireName());
        }
        long lineCount = 0;
        String outcome = "ended";
        try (stream) {
            String line;
            while (!handle.isCancelled() && (line = stream.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                var parsed = parser.parse(line, clock.millis());
                if (parsed.hasTimestamp() && alreadyDelivered(parsed.timestamp(), request)) {
                    continue;
                }
                lineCount++;
                if (parsed.hasTimestamp()) {
                    handle.recordSeen(parsed.timestamp());
                }
                sink.publishLog(new LogEvent(key.pod(), key.container(), request.sourceType(),
                        parsed.text(), parsed.timestampMillis()));
            }
            if (handle.isCancelled()) {
                outcome = "cancelled";
            }
        } catch (IOException e) {
            if (handle.isCancelled()) {
                outcome = "cancelled";
            } else {
                outcome = "error";
                log.warn("Log stream for {} failed after {} lines: {}", key, lineCount, e.getMessage());
            }
        }
        log.debug("Stopped following {} ({}, {} lines)", key, outcome, lineCount);
        recordFinished(outcome, lineCount);
    }

    private static boolean alreadyDelivered(Instant timestamp, TailRequest request) {
        Instant since = request.sinceTime();
        if (since == null) {
            return false;
        }
        return request.resumed() ? !timestamp.isAfter(since) : timestamp.isBefore(since);
    }

    private void recordFinished(String outcome, long lines) {
        if (metrics != null) {
            metrics.recordTailerFinished(outcome, lines);
        }
    }
}
