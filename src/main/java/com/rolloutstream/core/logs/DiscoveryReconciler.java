package com.rolloutstream.core.logs;

import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.cluster.ReleaseNotFoundException;
import com.rolloutstream.core.logging.MdcContext;
import com.rolloutstream.core.metrics.LogStreamMetrics;
import com.rolloutstream.core.model.ReleaseRef;
import com.rolloutstream.core.model.SourceFilter;
import com.rolloutstream.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps one {@link StreamSupervisor} per target the release currently resolves to.
 *
 * <p>Targets are re-resolved on a fixed interval and diffed by id: new ids get a supervisor,
 * vanished ids have theirs stopped. A failed periodic resolution leaves every running
 * supervisor in place.
 */
public class DiscoveryReconciler {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryReconciler.class);

    private final ReleaseRef release;
    private final SourceFilter filter;
    private final TargetResolver resolver;
    private final Function<Target, StreamSupervisor> supervisorFactory;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final Duration stopTimeout;
    private final LogStreamMetrics metrics;

    private final Object lock = new Object();
    private final Map<String, StreamSupervisor> supervisors = new LinkedHashMap<>();
    private boolean stopped;
    private ScheduledFuture<?> timer;

    public DiscoveryReconciler(ReleaseRef release, SourceFilter filter, TargetResolver resolver,
                               Function<Target, StreamSupervisor> supervisorFactory,
                               ScheduledExecutorService scheduler, Duration interval, Duration stopTimeout,
                               LogStreamMetrics metrics) {
        this.release = release;
        this.filter = filter;
        this.resolver = resolver;
        this.supervisorFactory = supervisorFactory;
        this.scheduler = scheduler;
        this.interval = interval;
        this.stopTimeout = stopTimeout;
        this.metrics = metrics;
    }

    /**
     * Resolves the release once and starts the periodic reconciliation.
     *
     * @throws ReleaseNotFoundException if the release does not exist
     */
    public void start() {
        List<Target> initial;
        try {
            initial = resolver.resolve(release, filter);
        } catch (ClusterAccessException e) {
            log.warn("Initial target resolution for {} failed, retrying in {}: {}",
                    release, interval, e.getMessage());
            recordFailure();
            initial = List.of();
        }
        apply(initial);

        ScheduledFuture<?> scheduled = scheduler.scheduleWithFixedDelay(this::reconcile,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        synchronized (lock) {
            if (stopped) {
                scheduled.cancel(false);
            } else {
                timer = scheduled;
            }
        }
    }

    void reconcile() {
        MdcContext.setRelease(release.id());
        try {
            List<Target> targets;
            try {
                targets = resolver.resolve(release, filter);
            } catch (ReleaseNotFoundException | ClusterAccessException e) {
                log.warn("Target resolution for {} failed, keeping current targets: {}", release, e.getMessage());
                recordFailure();
                return;
            }
            apply(targets);
        } catch (RuntimeException e) {
            log.error("Reconciling targets for {} failed", release, e);
        } finally {
            MdcContext.clear();
        }
    }

    private void apply(List<Target> targets) {
        Set<String> wanted = targets.stream().map(Target::id).collect(Collectors.toSet());
        List<StreamSupervisor> removed = new ArrayList<>();
        List<StreamSupervisor> added = new ArrayList<>();
        synchronized (lock) {
            if (stopped) {
                return;
            }
            var it = supervisors.entrySet().iterator();
            while (it.hasNext()) {
                var entry = it.next();
                if (!wanted.contains(entry.getKey())) {
                    removed.add(entry.getValue());
                    it.remove();
                }
            }
            for (Target target : targets) {
                if (!supervisors.containsKey(target.id())) {
                    StreamSupervisor supervisor = supervisorFactory.apply(target);
                    supervisors.put(target.id(), supervisor);
                    added.add(supervisor);
                }
            }
        }

        for (StreamSupervisor supervisor : removed) {
            log.info("Target {} is gone, stopping its streams", supervisor.target().id());
            supervisor.stop(stopTimeout);
        }
        for (StreamSupervisor supervisor : added) {
            log.info("Following target {} ({})", supervisor.target().id(), supervisor.target().kind().wireName());
            supervisor.start();
            if (isStopped()) {
                supervisor.cancel();
            }
        }
    }

    private void recordFailure() {
        if (metrics != null) {
            metrics.recordDiscoveryFailure("release");
        }
    }

    private boolean isStopped() {
        synchronized (lock) {
            return stopped;
        }
    }

    /** Stops reconciliation and cancels every supervisor without waiting. */
    public void stop() {
        List<StreamSupervisor> all;
        synchronized (lock) {
            if (stopped) {
                return;
            }
            stopped = true;
            if (timer != null) {
                timer.cancel(false);
            }
            all = new ArrayList<>(supervisors.values());
            supervisors.clear();
        }
        all.forEach(StreamSupervisor::cancel);
    }

    public List<String> activeTargets() {
        synchronized (lock) {
            return List.copyOf(supervisors.keySet());
        }
    }
}
