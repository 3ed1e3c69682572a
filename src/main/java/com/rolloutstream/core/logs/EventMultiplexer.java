package com.rolloutstream.core.logs;

import com.rolloutstream.core.metrics.LogStreamMetrics;
import com.rolloutstream.core.model.LogEvent;
import com.rolloutstream.core.model.PodInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single bounded FIFO shared by every tailer of a session, drained by one consumer.
 * <p>
 * Pushes never block: when the queue is full the message is dropped and counted.
 * Once closed, pushes are refused and the consumer sees the end of the feed as soon
 * as the remaining messages have been drained.
 */
public class EventMultiplexer {

    private static final Logger log = LoggerFactory.getLogger(EventMultiplexer.class);

    public static final String PODS_EVENT = "pods";
    public static final String LOG_EVENT = "log";
    public static final String PING_EVENT = "ping";

    private final BlockingQueue<StreamMessage> queue;
    private final int capacity;
    private final LogStreamMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    public EventMultiplexer(int capacity, LogStreamMetrics metrics) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.capacity = capacity;
        this.metrics = metrics;
    }

    public boolean publishLog(LogEvent event) {
        return offer(new StreamMessage(LOG_EVENT, event));
    }

    public boolean publishPods(List<PodInfo> pods) {
        return offer(new StreamMessage(PODS_EVENT, List.copyOf(pods)));
    }

    public boolean keepalive() {
        return offer(new StreamMessage(PING_EVENT, "keepalive"));
    }

    private boolean offer(StreamMessage message) {
        if (closed.get()) {
            return false;
        }
        if (queue.offer(message)) {
            return true;
        }
        long total = dropped.incrementAndGet();
        if (metrics != null) {
            metrics.recordDropped(message.event());
        }
        // first drop and every 100th after that, a saturated feed would otherwise flood the log
        if (total == 1 || total % 100 == 0) {
            log.warn("Stream buffer full (capacity: {}), dropped {} message(s) so far, latest: {}",
                    capacity, total, message.event());
        }
        return false;
    }

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return the message, or {@code null} if none arrived in time
     */
    public StreamMessage poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Closes the feed. Only the first call has an effect.
     *
     * @return {@code true} if this call closed the feed
     */
    public boolean close() {
        return closed.compareAndSet(false, true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** True once the feed is closed and every queued message has been taken. */
    public boolean isDrained() {
        return closed.get() && queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
