package com.rolloutstream.core.logs;

import com.rolloutstream.cluster.LogStream;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory {@link LogStream}. Serves the given lines, then either ends or blocks until
 * closed, mimicking a follow read on a running container.
 */
class FakeLogStream implements LogStream {

    private static final String END = "\u0000end";

    private final LinkedBlockingQueue<String> lines = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private FakeLogStream(List<String> initial, boolean ends) {
        lines.addAll(initial);
        if (ends) {
            lines.add(END);
        }
    }

    /** A stream that ends after {@code lines}, like a terminated container. */
    static FakeLogStream ending(String... lines) {
        return new FakeLogStream(List.of(lines), true);
    }

    /** A stream that stays open after {@code lines} until closed. */
    static FakeLogStream following(String... lines) {
        return new FakeLogStream(List.of(lines), false);
    }

    void append(String line) {
        lines.add(line);
    }

    boolean isClosed() {
        return closed.get();
    }

    @Override
    public String readLine() throws IOException {
        try {
            String line = lines.take();
            if (END.equals(line)) {
                lines.add(END);
                return null;
            }
            return line;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            lines.add(END);
        }
    }
}
