package com.phillippitts.captionhub.service.session;

import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.Session;
import com.phillippitts.captionhub.service.translation.SegmentDispatch;
import com.phillippitts.captionhub.service.translation.SourceContextWindow;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable runtime state of one live session: the current snapshot, the in-flight segment
 * dispatches and the rolling translation context.
 *
 * <p>Lifecycle transitions and segment admission happen under {@link #lock()}. A segment is
 * admitted under the lock but dispatched after it is released; the admission count lets the
 * end sequence wait until every admitted segment is tracked as in flight.
 */
final class SessionRuntime {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition admissionsDone = lock.newCondition();
    private final Set<SegmentDispatch> inFlight = ConcurrentHashMap.newKeySet();
    private final SourceContextWindow context;
    private volatile Session session;
    private int admitting = 0; // guarded by lock

    SessionRuntime(Session session, int contextSize) {
        this.session = session;
        this.context = new SourceContextWindow(contextSize);
    }

    ReentrantLock lock() {
        return lock;
    }

    Session session() {
        return session;
    }

    void update(Session next) {
        this.session = next;
    }

    SourceContextWindow context() {
        return context;
    }

    /**
     * Registers one admitted segment. Caller holds the lock.
     */
    void beginAdmission() {
        admitting++;
    }

    /**
     * Tracks the dispatch of an admitted segment, or just releases the admission when dispatch
     * failed ({@code dispatch == null}).
     */
    void endAdmission(SegmentDispatch dispatch) {
        lock.lock();
        try {
            if (dispatch != null) {
                track(dispatch);
            }
            admitting--;
            if (admitting == 0) {
                admissionsDone.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} when no admitted segment is waiting for dispatch within the timeout
     */
    boolean awaitAdmissions(long timeoutNanos) throws InterruptedException {
        long remaining = timeoutNanos;
        lock.lock();
        try {
            while (admitting > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = admissionsDone.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void track(SegmentDispatch dispatch) {
        inFlight.add(dispatch);
        dispatch.completion().whenComplete((ignored, error) -> inFlight.remove(dispatch));
    }

    List<SegmentDispatch> inFlight() {
        return new ArrayList<>(inFlight);
    }

    List<ChannelKey> channelKeys() {
        List<ChannelKey> keys = new ArrayList<>();
        for (String language : session.targetLanguages()) {
            keys.add(new ChannelKey(session.id(), language));
        }
        return keys;
    }
}
