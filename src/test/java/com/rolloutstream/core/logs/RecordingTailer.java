package com.rolloutstream.core.logs;

import com.rolloutstream.cluster.ClusterGateway;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.mockito.Mockito.mock;

/**
 * Tailer that only records what it was asked to follow. Handles stay running until a test
 * finishes them with {@link #finish(int, java.time.Instant)}.
 */
class RecordingTailer extends ContainerTailer {

    final List<TailRequest> requests = new CopyOnWriteArrayList<>();
    final List<TailHandle> handles = new CopyOnWriteArrayList<>();
    final List<Integer> queuedAtStart = new CopyOnWriteArrayList<>();

    RecordingTailer() {
        super(mock(ClusterGateway.class), 100, null);
    }

    @Override
    public void run(TailRequest request, EventMultiplexer sink, TailHandle handle) {
        requests.add(request);
        handles.add(handle);
        queuedAtStart.add(sink.size());
    }

    void finish(int index, java.time.Instant lastSeen) {
        TailHandle handle = handles.get(index);
        if (lastSeen != null) {
            handle.recordSeen(lastSeen);
        }
        handle.markDone();
    }

    List<String> keys() {
        return requests.stream().map(r -> r.key().toString()).toList();
    }
}
