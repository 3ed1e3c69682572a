package com.rolloutstream.core.logs;

import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.core.logging.MdcContext;
import com.rolloutstream.core.metrics.LogStreamMetrics;
import com.rolloutstream.core.model.ClusterPod;
import com.rolloutstream.core.model.PodInfo;
import com.rolloutstream.core.model.StreamKey;
import com.rolloutstream.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps exactly one tailer running per live (pod, container) of a single target.
 *
 * <p>Every sync pass enumerates the target's pods, starts tailers for new stream keys,
 * cancels tailers whose pod or container vanished and publishes the target's pods to the
 * roster. A changed roster is pushed to the client before new tailers start. A tailer that
 * ended while its container still exists is restarted from the last timestamp it delivered.
 * The lock only guards the bookkeeping maps; cluster calls and tailer cancellation happen
 * outside it.
 */
public class StreamSupervisor {

    private static final Logger log = LoggerFactory.getLogger(StreamSupervisor.class);

    private final String releaseId;
    private final Target target;
    private final PodEnumerator enumerator;
    private final ContainerTailer tailer;
    private final EventMultiplexer sink;
    private final PodRoster roster;
    private final ExecutorService tailerPool;
    private final ScheduledExecutorService scheduler;
    private final Duration syncInterval;
    private final Instant initialSince;
    private final LogStreamMetrics metrics;

    private final Object lock = new Object();
    private final Map<StreamKey, TailHandle> active = new HashMap<>();
    private final Map<StreamKey, Instant> cursors = new HashMap<>();
    private boolean stopped;
    private ScheduledFuture<?> timer;

    public StreamSupervisor(String releaseId, Target target, PodEnumerator enumerator, ContainerTailer tailer,
                            EventMultiplexer sink, PodRoster roster, ExecutorService tailerPool,
                            ScheduledExecutorService scheduler, Duration syncInterval, Instant initialSince,
                            LogStreamMetrics metrics) {
        this.releaseId = releaseId;
        this.target = target;
        this.enumerator = enumerator;
        this.tailer = tailer;
        this.sink = sink;
        this.roster = roster;
        this.tailerPool = tailerPool;
        this.scheduler = scheduler;
        this.syncInterval = syncInterval;
        this.initialSince = initialSince;
        this.metrics = metrics;
    }

    public Target target() {
        return target;
    }

    /** Runs a first sync immediately, then re-syncs on the configured interval. */
    public void start() {
        sync();
        ScheduledFuture<?> scheduled = scheduler.scheduleWithFixedDelay(this::safeSync,
                syncInterval.toMillis(), syncInterval.toMillis(), TimeUnit.MILLISECONDS);
        synchronized (lock) {
            if (stopped) {
                scheduled.cancel(false);
            } else {
                timer = scheduled;
            }
        }
    }

    private void safeSync() {
        try {
            sync();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the periodic task for good.
            log.warn("Pod sync for target {} failed: {}", target.id(), e.getMessage(), e);
        }
    }

    void sync() {
        MdcContext.setTarget(releaseId, target.id());
        try {
            List<ClusterPod> pods;
            try {
                pods = enumerator.enumerate(target);
            } catch (ClusterAccessException e) {
                log.warn("Listing pods for target {} failed, keeping current streams: {}",
                        target.id(), e.getMessage());
                if (metrics != null) {
                    metrics.recordDiscoveryFailure("pods");
                }
                return;
            }
            reconcile(pods);
        } finally {
            MdcContext.clear();
        }
    }

    private void reconcile(List<ClusterPod> pods) {
        Map<StreamKey, String> desired = new LinkedHashMap<>();
        List<PodInfo> podInfos = new ArrayList<>();
        for (ClusterPod pod : pods) {
            podInfos.add(new PodInfo(pod.name(), pod.namespace(), target.kind()));
            for (String container : containersOf(pod)) {
                desired.put(new StreamKey(pod.name(), container), pod.namespace());
            }
        }

        List<TailHandle> toCancel = new ArrayList<>();
        List<TailRequest> toStart = new ArrayList<>();
        List<TailHandle> handles = new ArrayList<>();
        boolean rosterChanged;
        synchronized (lock) {
            if (stopped) {
                return;
            }
            rosterChanged = roster.update(target.id(), podInfos);

            var it = active.entrySet().iterator();
            while (it.hasNext()) {
                var entry = it.next();
                TailHandle handle = entry.getValue();
                if (!desired.containsKey(entry.getKey())) {
                    toCancel.add(handle);
                    cursors.remove(entry.getKey());
                    it.remove();
                } else if (handle.isDone()) {
                    if (handle.lastSeen() != null) {
                        cursors.put(entry.getKey(), handle.lastSeen());
                    }
                    it.remove();
                }
            }
            cursors.keySet().retainAll(desired.keySet());

            for (var entry : desired.entrySet()) {
                StreamKey key = entry.getKey();
                if (active.containsKey(key)) {
                    continue;
                }
                Instant cursor = cursors.get(key);
                TailHandle handle = new TailHandle(key);
                active.put(key, handle);
                handles.add(handle);
                toStart.add(new TailRequest(releaseId, target.id(), entry.getValue(), key, target.kind(),
                        cursor != null ? cursor : initialSince, cursor != null));
            }
        }

        toCancel.forEach(handle -> {
            log.debug("Container {} is gone, cancelling its tailer", handle.key());
            handle.cancel();
        });
        if (rosterChanged) {
            // clients see a pod in the roster before any of its lines
            sink.publishPods(roster.snapshot());
        }
        for (int i = 0; i < toStart.size(); i++) {
            submit(toStart.get(i), handles.get(i));
        }
    }

    private List<String> containersOf(ClusterPod pod) {
        List<String> names = new ArrayList<>(pod.initContainers());
        names.addAll(pod.containers());
        String hint = target.containerHint();
        if (hint != null && !hint.isBlank()) {
            return names.contains(hint) ? List.of(hint) : List.of();
        }
        return names;
    }

    private void submit(TailRequest request, TailHandle handle) {
        try {
            tailerPool.submit(() -> tailer.run(request, sink, handle));
        } catch (RejectedExecutionException e) {
            log.debug("Tailer pool is shut down, not starting {}", request.key());
            handle.markDone();
        }
    }

    /** Stops syncing and cancels every tailer without waiting for them. */
    public void cancel() {
        List<TailHandle> handles;
        synchronized (lock) {
            if (stopped) {
                return;
            }
            stopped = true;
            if (timer != null) {
                timer.cancel(false);
            }
            handles = new ArrayList<>(active.values());
        }
        handles.forEach(TailHandle::cancel);
    }

    /**
     * Cancels all tailers, removes the target's pods from the roster and waits up to
     * {@code timeout} for the tailers to finish.
     *
     * @return {@code true} if every tailer finished in time
     */
    public boolean stop(Duration timeout) {
        cancel();
        List<TailHandle> handles;
        synchronized (lock) {
            handles = new ArrayList<>(active.values());
            active.clear();
            cursors.clear();
        }
        roster.remove(target.id());

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (TailHandle handle : handles) {
                long remaining = deadline - System.nanoTime();
                if (!handle.awaitDone(Duration.ofNanos(Math.max(0, remaining)))) {
                    log.warn("Tailers of target {} did not finish within {}", target.id(), timeout);
                    return false;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return true;
    }

    /** Stream keys with a live (not yet finished) tailer. */
    public List<StreamKey> activeStreams() {
        synchronized (lock) {
            return active.entrySet().stream()
                    .filter(e -> !e.getValue().isDone())
                    .map(Map.Entry::getKey)
                    .sorted((a, b) -> a.toString().compareTo(b.toString()))
                    .toList();
        }
    }

    public boolean isStopped() {
        synchronized (lock) {
            return stopped;
        }
    }
}
