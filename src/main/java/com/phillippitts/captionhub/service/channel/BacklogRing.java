package com.phillippitts.captionhub.service.channel;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity ring of the most recent released translations of a channel, replayed to
 * late-joining subscribers. Adding beyond capacity evicts the oldest entry.
 *
 * <p>A capacity of zero keeps nothing.
 */
public final class BacklogRing<T> {

    private final int capacity;
    private final Deque<T> entries;

    public BacklogRing(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.max(capacity, 1));
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void add(T item) {
        if (capacity == 0) {
            return;
        }
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(item);
    }

    /**
     * @return retained items, oldest first
     */
    public synchronized List<T> snapshot() {
        return new ArrayList<>(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
