package com.rolloutstream.cluster;

import java.io.Closeable;
import java.io.IOException;

/**
 * An open container log read. Closing it from another thread unblocks a pending {@link #readLine()}.
 */
public interface LogStream extends Closeable {

    /**
     * Returns the next line, blocking until one is available.
     *
     * @return the line, or {@code null} once the stream has ended
     */
    String readLine() throws IOException;
}
