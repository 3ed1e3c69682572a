package com.rolloutstream.core.logs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * One subscription's running tree: the reconciler (or a single supervisor), every tailer
 * under it, the roster broadcast and the multiplexer they all feed.
 *
 * <p>The session owns its own scheduler and tailer pool, so {@link #close()} can tear the
 * whole tree down at once. Closing waits a bounded time for tasks, then continues regardless
 * and closes the multiplexer exactly once.
 */
public class LogStreamSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LogStreamSession.class);

    private final String name;
    private final EventMultiplexer multiplexer;
    private final PodRoster roster;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService tailerPool;
    private final Duration rosterInterval;
    private final Duration shutdownTimeout;
    private final Consumer<LogStreamSession> onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile DiscoveryReconciler reconciler;
    private volatile StreamSupervisor singleSupervisor;

    LogStreamSession(String name, EventMultiplexer multiplexer, PodRoster roster, int timerThreads,
                     Duration rosterInterval, Duration shutdownTimeout, Consumer<LogStreamSession> onClose) {
        this.name = name;
        this.multiplexer = multiplexer;
        this.roster = roster;
        this.rosterInterval = rosterInterval;
        this.shutdownTimeout = shutdownTimeout;
        this.onClose = onClose;
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, timerThreads), daemonFactory("stream-timer-" + name));
        this.tailerPool = Executors.newCachedThreadPool(daemonFactory("stream-tail-" + name));
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    ScheduledExecutorService scheduler() {
        return scheduler;
    }

    ExecutorService tailerPool() {
        return tailerPool;
    }

    PodRoster roster() {
        return roster;
    }

    EventMultiplexer multiplexer() {
        return multiplexer;
    }

    /** Starts discovery, then broadcasts the roster right away and on every interval. */
    void start(DiscoveryReconciler discovery) {
        this.reconciler = discovery;
        discovery.start();
        startRosterBroadcast();
    }

    void start(StreamSupervisor supervisor) {
        this.singleSupervisor = supervisor;
        supervisor.start();
        startRosterBroadcast();
    }

    private void startRosterBroadcast() {
        try {
            scheduler.scheduleAtFixedRate(this::broadcastRoster, 0, rosterInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Session {} closed before the roster broadcast started", name);
        }
    }

    private void broadcastRoster() {
        multiplexer.publishPods(roster.snapshot());
    }

    public String name() {
        return name;
    }

    /** Queues a keepalive; dropped like any other event when the buffer is full. */
    public boolean keepalive() {
        return multiplexer.keepalive();
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or {@code null} on timeout or once the session has finished
     */
    public StreamMessage poll(Duration timeout) throws InterruptedException {
        return multiplexer.poll(timeout);
    }

    /** True once the session is closed and every queued event has been consumed. */
    public boolean isFinished() {
        return multiplexer.isDrained();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public List<String> activeTargets() {
        DiscoveryReconciler current = reconciler;
        if (current != null) {
            return current.activeTargets();
        }
        StreamSupervisor single = singleSupervisor;
        return single != null ? List.of(single.target().id()) : List.of();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing log stream session {}", name);
        DiscoveryReconciler currentReconciler = reconciler;
        if (currentReconciler != null) {
            currentReconciler.stop();
        }
        StreamSupervisor single = singleSupervisor;
        if (single != null) {
            single.cancel();
        }

        scheduler.shutdown();
        tailerPool.shutdown();
        try {
            long deadline = System.nanoTime() + shutdownTimeout.toNanos();
            boolean schedulerDone = scheduler.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            long remaining = Math.max(0, deadline - System.nanoTime());
            boolean tailersDone = tailerPool.awaitTermination(remaining, TimeUnit.NANOSECONDS);
            if (!schedulerDone || !tailersDone) {
                log.warn("Session {} tasks did not finish within {}, continuing shutdown", name, shutdownTimeout);
                scheduler.shutdownNow();
                tailerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            tailerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        multiplexer.close();
        if (onClose != null) {
            onClose.accept(this);
        }
    }
}
