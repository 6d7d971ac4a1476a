package com.phillippitts.captionhub.service.translation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Rolling window of the most recent source segments of one session, passed to the
 * translator as context so consecutive sentences translate consistently.
 *
 * <p>Thread-safe; appends happen on the ingest path, snapshots on the same path just before.
 */
public final class SourceContextWindow {

    private final int capacity;
    private final Deque<String> recent;

    /**
     * @param capacity number of segments retained; 0 disables context
     */
    public SourceContextWindow(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.recent = new ArrayDeque<>(Math.max(capacity, 1));
    }

    /**
     * Returns the current context and then records {@code text} as the newest entry.
     *
     * @param text source text of the segment being dispatched
     * @return preceding segments, oldest first
     */
    public synchronized List<String> snapshotAndAppend(String text) {
        List<String> snapshot = List.copyOf(recent);
        if (capacity > 0) {
            if (recent.size() == capacity) {
                recent.removeFirst();
            }
            recent.addLast(text);
        }
        return snapshot;
    }

    public synchronized int size() {
        return recent.size();
    }
}
