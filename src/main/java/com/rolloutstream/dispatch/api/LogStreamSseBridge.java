package com.rolloutstream.dispatch.api;

import com.rolloutstream.core.logs.LogStreamProperties;
import com.rolloutstream.core.logs.LogStreamSession;
import com.rolloutstream.core.logs.StreamMessage;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges {@link LogStreamSession}s to {@link SseEmitter} instances.
 * <p>
 * Each connected client gets a drain thread that polls the session and writes every message
 * as a named SSE event ({@code pods}, {@code log} or {@code ping}). The session is closed when
 * the emitter completes, times out or fails, and the emitter is completed once the session
 * has finished.
 * <p>
 * Keepalives are queued into every session on a fixed interval so idle connections survive
 * proxies that cut silent streams.
 */
@Service
public class LogStreamSseBridge {

    private static final Logger log = LoggerFactory.getLogger(LogStreamSseBridge.class);

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final Duration keepaliveInterval;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService keepaliveScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-keepalive");
        t.setDaemon(true);
        return t;
    });

    private final AtomicInteger drainThreads = new AtomicInteger();
    private final ExecutorService drainPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-drain-" + drainThreads.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public LogStreamSseBridge(LogStreamProperties properties) {
        this.keepaliveInterval = properties.getKeepaliveInterval();
        this.timeoutMs = properties.getEmitterTimeout().toMillis();
    }

    @PostConstruct
    void startKeepalive() {
        keepaliveScheduler.scheduleAtFixedRate(this::sendKeepalives,
                keepaliveInterval.toMillis(), keepaliveInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("SSE keepalive scheduler started (interval={})", keepaliveInterval);
    }

    @PreDestroy
    void stop() {
        keepaliveScheduler.shutdown();
        for (EmitterRegistration registration : activeRegistrations) {
            registration.session().close();
        }
        drainPool.shutdown();
        try {
            if (!drainPool.awaitTermination(5, TimeUnit.SECONDS)) {
                drainPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            drainPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE bridge stopped");
    }

    void sendKeepalives() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Queueing keepalive for {} active log streams", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            registration.session().keepalive();
        }
    }

    /**
     * Creates an emitter that streams the session until either side goes away.
     */
    public SseEmitter attach(LogStreamSession session) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var registration = new EmitterRegistration(session, emitter);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for {}", session.name());
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for {}", session.name());
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", session.name(), ex.getMessage());
            cleanup(registration);
        });

        drainPool.submit(() -> drain(registration));
        log.info("SSE log stream attached for {} (timeout={}ms)", session.name(), timeoutMs);
        return emitter;
    }

    /**
     * Creates an emitter that carries a single {@code error} event and completes.
     */
    public SseEmitter error(String message) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        try {
            emitter.send(SseEmitter.event().name("error").data(Map.of("error", message)));
            emitter.complete();
        } catch (IOException e) {
            log.debug("Failed to send SSE error event: {}", e.getMessage());
            emitter.completeWithError(e);
        }
        return emitter;
    }

    public int activeStreamCount() {
        return activeRegistrations.size();
    }

    private void drain(EmitterRegistration registration) {
        LogStreamSession session = registration.session();
        try {
            while (!session.isFinished()) {
                StreamMessage message = session.poll(POLL_INTERVAL);
                if (message == null) {
                    continue;
                }
                registration.emitter().send(SseEmitter.event()
                        .name(message.event())
                        .data(message.data()));
            }
            registration.emitter().complete();
        } catch (IOException | IllegalStateException e) {
            // client went away; the emitter callbacks may not fire for a write failure
            log.debug("Log stream {} ended on send: {}", session.name(), e.getMessage());
            cleanup(registration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cleanup(registration);
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.session().close();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            LogStreamSession session,
            SseEmitter emitter
    ) {}
}
