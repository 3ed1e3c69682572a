package com.rolloutstream.core.logs;

import com.rolloutstream.cluster.ClusterGateway;
import com.rolloutstream.cluster.ReleaseMetadataSource;
import com.rolloutstream.core.metrics.LogStreamMetrics;
import com.rolloutstream.core.model.ReleaseRef;
import com.rolloutstream.core.model.SourceFilter;
import com.rolloutstream.core.model.SourceType;
import com.rolloutstream.core.model.StreamSubscription;
import com.rolloutstream.core.model.Target;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point of the log engine. Opens one {@link LogStreamSession} per subscriber and
 * tracks the open ones so they can be closed on shutdown.
 */
@Service
public class LogStreamEngine {

    private static final Logger log = LoggerFactory.getLogger(LogStreamEngine.class);

    private final TargetResolver resolver;
    private final PodEnumerator enumerator;
    private final ContainerTailer tailer;
    private final LogStreamProperties properties;
    private final LogStreamMetrics metrics;
    private final CopyOnWriteArrayList<LogStreamSession> sessions = new CopyOnWriteArrayList<>();

    @Autowired
    public LogStreamEngine(ClusterGateway gateway, ReleaseMetadataSource releaseMetadata,
                           LogStreamProperties properties, LogStreamMetrics metrics) {
        this(new TargetResolver(gateway, releaseMetadata, metrics),
                new PodEnumerator(gateway),
                new ContainerTailer(gateway, properties.getInitialTailLines(), metrics),
                properties, metrics);
    }

    LogStreamEngine(TargetResolver resolver, PodEnumerator enumerator, ContainerTailer tailer,
                    LogStreamProperties properties, LogStreamMetrics metrics) {
        this.resolver = resolver;
        this.enumerator = enumerator;
        this.tailer = tailer;
        this.properties = properties;
        this.metrics = metrics;
        if (metrics != null) {
            metrics.registerActiveSessions(sessions::size);
        }
    }

    /**
     * Starts streaming a release.
     *
     * @throws com.rolloutstream.cluster.ReleaseNotFoundException if the release does not exist;
     *         nothing is left running in that case
     */
    public LogStreamSession open(StreamSubscription subscription) {
        ReleaseRef release = subscription.release();
        LogStreamSession session = newSession(release.id());
        Instant since = subscription.since();
        var reconciler = new DiscoveryReconciler(release, subscription.filter(), resolver,
                target -> newSupervisor(release.id(), target, session, since),
                session.scheduler(), properties.getDiscoveryInterval(), properties.getShutdownTimeout(), metrics);
        try {
            session.start(reconciler);
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
        log.info("Opened log stream for {} (filter: {}, since: {})", release, subscription.filter(), since);
        return session;
    }

    /**
     * Follows one named pod without discovery. Restricts to {@code container} when it is given.
     */
    public LogStreamSession openSinglePod(String namespace, String pod, String container,
                                          SourceType type, Instant since) {
        Target target = Target.pod(namespace, pod, container, type);
        LogStreamSession session = newSession(target.id());
        try {
            session.start(newSupervisor(target.id(), target, session, since));
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
        log.info("Opened log stream for pod {}/{} (container: {})", namespace, pod, container);
        return session;
    }

    /** Resolves the targets a release currently maps to, without streaming anything. */
    public List<Target> resolveTargets(ReleaseRef release, SourceFilter filter) {
        return resolver.resolve(release, filter);
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    private LogStreamSession newSession(String name) {
        var session = new LogStreamSession(name,
                new EventMultiplexer(properties.getBufferCapacity(), metrics),
                new PodRoster(),
                properties.getTimerThreads(),
                properties.getRosterInterval(),
                properties.getShutdownTimeout(),
                sessions::remove);
        sessions.add(session);
        return session;
    }

    private StreamSupervisor newSupervisor(String sessionName, Target target, LogStreamSession session, Instant since) {
        return new StreamSupervisor(sessionName, target, enumerator, tailer, session.multiplexer(), session.roster(),
                session.tailerPool(), session.scheduler(), properties.getPodSyncInterval(), since, metrics);
    }

    @PreDestroy
    void closeAll() {
        if (sessions.isEmpty()) {
            return;
        }
        log.info("Closing {} open log stream session(s)", sessions.size());
        for (LogStreamSession session : List.copyOf(sessions)) {
            session.close();
        }
    }
}
