package com.rolloutstream.core.logs;

import com.rolloutstream.cluster.LogStream;
import com.rolloutstream.core.model.StreamKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and completion handle for one running tailer.
 * <p>
 * A follow read blocks in socket I/O, which thread interruption does not reliably
 * unblock, so {@link #cancel()} closes the attached stream as well.
 */
public class TailHandle {

    private static final Logger log = LoggerFactory.getLogger(TailHandle.class);

    private final StreamKey key;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile LogStream stream;
    private volatile Instant lastSeen;

    public TailHandle(StreamKey key) {
        this.key = key;
    }

    public StreamKey key() {
        return key;
    }

    /**
     * Attaches the open stream so cancellation can close it.
     *
     * @return {@code false} if the handle was already cancelled; the stream is closed in that case
     */
    boolean attach(LogStream openedStream) {
        this.stream = openedStream;
        if (cancelled.get()) {
            closeQuietly(openedStream);
            return false;
        }
        return true;
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        LogStream current = stream;
        if (current != null) {
            closeQuietly(current);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void markDone() {
        done.countDown();
    }

    public boolean isDone() {
        return done.getCount() == 0;
    }

    public boolean awaitDone(Duration timeout) throws InterruptedException {
        return done.await(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    void recordSeen(Instant timestamp) {
        this.lastSeen = timestamp;
    }

    /** Timestamp of the last line read with a timestamp, or {@code null}. */
    public Instant lastSeen() {
        return lastSeen;
    }

    private void closeQuietly(LogStream toClose) {
        try {
            toClose.close();
        } catch (IOException e) {
            log.debug("Closing log stream {} failed: {}", key, e.getMessage());
        }
    }
}
