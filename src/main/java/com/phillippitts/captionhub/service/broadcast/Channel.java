package com.phillippitts.captionhub.service.broadcast;

import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.Translation;
import com.phillippitts.captionhub.service.channel.BacklogRing;
import com.phillippitts.captionhub.service.channel.ReorderBuffer;
import com.phillippitts.captionhub.service.metrics.PipelineMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

/**
 * One ordered output stream: a target language within a session.
 *
 * <p>Owns the reorder buffer, the backlog of recently released captions and the live
 * subscriber set. All three are mutated only while holding the channel lock, which makes
 * "replay backlog, then join live" atomic with respect to releases.
 *
 * <p>When translations are held behind a missing slot, a stall timer is armed on the
 * scheduler. If the same slot is still missing when it fires, the gap is skipped; if progress
 * was made in the meantime, the timer is re-armed for the new stall.
 */
public final class Channel {

    private static final Logger LOG = LogManager.getLogger(Channel.class);

    /**
     * Subscribers that must be disconnected, collected while iterating under the lock.
     */
    record Eviction(Subscriber subscriber, DisconnectReason reason) {
    }

    private final ChannelKey key;
    private final ReorderBuffer buffer;
    private final BacklogRing<Translation> backlog;
    private final Map<String, Subscriber> subscribers = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final TaskScheduler scheduler;
    private final Duration slotTimeout;
    private final ReleaseListener releaseListener;
    private final PipelineMetricsPublisher metrics;
    private final BiConsumer<Subscriber, DisconnectReason> evictionHandler;

    private ScheduledFuture<?> stallTimer;
    private long stalledSlot = -1;
    private boolean closed = false;

    Channel(ChannelKey key,
            int maxPending,
            int backlogSize,
            Duration slotTimeout,
            TaskScheduler scheduler,
            ReleaseListener releaseListener,
            PipelineMetricsPublisher metrics,
            BiConsumer<Subscriber, DisconnectReason> evictionHandler) {
        this.key = Objects.requireNonNull(key, "key");
        this.buffer = new ReorderBuffer(key, maxPending);
        this.backlog = new BacklogRing<>(backlogSize);
        this.slotTimeout = Objects.requireNonNull(slotTimeout, "slotTimeout");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.releaseListener = releaseListener == null ? ReleaseListener.NONE : releaseListener;
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
        this.evictionHandler = Objects.requireNonNull(evictionHandler, "evictionHandler");
    }

    public ChannelKey key() {
        return key;
    }

    /**
     * Accepts one terminal translation and releases whatever became contiguous.
     *
     * @return subscribers that overflowed and must be disconnected
     */
    List<Eviction> accept(Translation translation) {
        lock.lock();
        try {
            if (closed) {
                LOG.debug("Dropping seq={} for closed channel {}", translation.sequence(), key);
                return List.of();
            }
            ReorderBuffer.Release release = buffer.offer(translation);
            if (release.late()) {
                metrics.lateArrival();
                LOG.debug("Late arrival seq={} on {} (nextExpected={})",
                        translation.sequence(), key, buffer.nextExpected());
                return List.of();
            }
            List<Eviction> evictions = publish(release.released());
            updateStallTimer();
            return evictions;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically queues the replay handshake for {@code subscriber} and adds it to the live set.
     *
     * @param lastSequence last sequence the client already has, or {@code null} for full backlog
     * @return number of captions replayed, or -1 when the channel is closed or the replay overflowed
     */
    int subscribe(Subscriber subscriber, Long lastSequence) {
        lock.lock();
        try {
            if (closed) {
                return -1;
            }
            long after = lastSequence == null ? 0 : lastSequence;
            List<Translation> replay = new ArrayList<>();
            for (Translation t : backlog.snapshot()) {
                if (t.sequence() > after) {
                    replay.add(t);
                }
            }
            if (subscriber.enqueueControl(OutboundMessage.replayStart(key, replay.size()))
                    != Subscriber.EnqueueResult.ACCEPTED) {
                return -1;
            }
            for (Translation t : replay) {
                if (subscriber.enqueueCaption(t, true) != Subscriber.EnqueueResult.ACCEPTED) {
                    return -1;
                }
            }
            if (subscriber.enqueueControl(OutboundMessage.replayEnd(key)) != Subscriber.EnqueueResult.ACCEPTED) {
                return -1;
            }
            subscribers.put(subscriber.id(), subscriber);
            return replay.size();
        } finally {
            lock.unlock();
        }
    }

    boolean remove(Subscriber subscriber) {
        lock.lock();
        try {
            return subscribers.remove(subscriber.id(), subscriber);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flushes the reorder buffer, tells every subscriber the session ended and empties the
     * live set. Idempotent.
     *
     * @return subscribers that could not be sent the end frame and must be disconnected now
     */
    List<Eviction> close() {
        lock.lock();
        try {
            if (closed) {
                return List.of();
            }
            cancelStallTimer();
            List<Translation> flushed = buffer.flush(ReorderBuffer.REASON_FLUSH);
            List<Eviction> evictions = new ArrayList<>(publish(flushed));
            closed = true;
            for (Subscriber subscriber : List.copyOf(subscribers.values())) {
                if (subscriber.enqueueControl(OutboundMessage.sessionEnded(key))
                        != Subscriber.EnqueueResult.ACCEPTED) {
                    evictions.add(new Eviction(subscriber, DisconnectReason.SESSION_ENDED));
                }
            }
            subscribers.clear();
            if (!flushed.isEmpty()) {
                LOG.info("Channel {} flushed {} held slot(s) on close", key, flushed.size());
            }
            return evictions;
        } finally {
            lock.unlock();
        }
    }

    List<Subscriber> stalledSubscribers(long nowNanos, long timeoutNanos) {
        lock.lock();
        try {
            List<Subscriber> stalled = new ArrayList<>();
            for (Subscriber s : subscribers.values()) {
                if (s.isSendStalled(nowNanos, timeoutNanos)) {
                    stalled.add(s);
                }
            }
            return stalled;
        } finally {
            lock.unlock();
        }
    }

    public int subscriberCount() {
        lock.lock();
        try {
            return subscribers.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public long nextExpected() {
        lock.lock();
        try {
            return buffer.nextExpected();
        } finally {
            lock.unlock();
        }
    }

    public List<Translation> backlog() {
        return backlog.snapshot();
    }

    /**
     * Stall timer callback. Package-private so tests can fire it without waiting.
     *
     * @return subscribers that overflowed while releasing
     */
    List<Eviction> onStallTimeout(long slot) {
        lock.lock();
        try {
            stallTimer = null;
            if (closed) {
                return List.of();
            }
            List<Eviction> evictions = List.of();
            if (buffer.isStalled() && buffer.nextExpected() == slot) {
                List<Translation> released = buffer.skipStalled(ReorderBuffer.REASON_TIMEOUT);
                LOG.warn("Slot timeout on {}: skipped from seq={} (released {})", key, slot, released.size());
                evictions = publish(released);
            }
            updateStallTimer();
            return evictions;
        } finally {
            lock.unlock();
        }
    }

    private List<Eviction> publish(List<Translation> released) {
        List<Eviction> evictions = new ArrayList<>();
        for (Translation t : released) {
            if (t.outcome() == Translation.Outcome.SKIPPED) {
                metrics.slotSkipped(t.failureReason());
            }
            metrics.released(key.language());
            backlog.add(t);
            for (Subscriber subscriber : List.copyOf(subscribers.values())) {
                Subscriber.EnqueueResult result = subscriber.enqueueCaption(t, false);
                if (result == Subscriber.EnqueueResult.QUEUE_FULL) {
                    evictions.add(new Eviction(subscriber, DisconnectReason.QUEUE_OVERFLOW));
                } else if (result == Subscriber.EnqueueResult.DRAIN_REJECTED) {
                    evictions.add(new Eviction(subscriber, DisconnectReason.DELIVERY_REJECTED));
                }
            }
            for (Eviction e : evictions) {
                subscribers.remove(e.subscriber().id(), e.subscriber());
            }
            try {
                releaseListener.onReleased(t);
            } catch (RuntimeException e) {
                LOG.error("Release listener failed for seq={} on {}", t.sequence(), key, e);
            }
        }
        return evictions;
    }

    private void updateStallTimer() {
        if (!buffer.isStalled()) {
            cancelStallTimer();
            return;
        }
        long slot = buffer.nextExpected();
        if (stallTimer != null && stalledSlot == slot) {
            return;
        }
        cancelStallTimer();
        stalledSlot = slot;
        stallTimer = scheduler.schedule(() -> fireStallTimer(slot), Instant.now().plus(slotTimeout));
    }

    private void fireStallTimer(long slot) {
        List<Eviction> evictions = onStallTimeout(slot);
        for (Eviction e : evictions) {
            evictionHandler.accept(e.subscriber(), e.reason());
        }
    }

    private void cancelStallTimer() {
        if (stallTimer != null) {
            stallTimer.cancel(false);
            stallTimer = null;
        }
        stalledSlot = -1;
    }
}
