package com.phillippitts.captionhub.service.broadcast;

import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.Translation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * One live subscriber of a channel: a bounded outbound queue drained on the delivery pool.
 *
 * <p>The channel enqueues under its lock and never blocks on the transport. At most one
 * drain task per subscriber runs at a time, so frames reach the connection in enqueue order.
 * Captions are only enqueued with strictly increasing sequence numbers.
 *
 * <p>Failures detected while draining are reported through the failure handler, which
 * removes the subscriber from its channel.
 */
public final class Subscriber {

    private static final Logger LOG = LogManager.getLogger(Subscriber.class);

    /**
     * Result of offering a frame to the outbound queue.
     */
    public enum EnqueueResult {
        ACCEPTED,
        /** Not queued: duplicate or stale sequence, or subscriber already disconnected. */
        IGNORED,
        QUEUE_FULL,
        DRAIN_REJECTED
    }

    private final ChannelKey channel;
    private final SubscriberConnection connection;
    private final BlockingQueue<OutboundMessage> queue;
    private final Executor deliveryExecutor;
    private final BiConsumer<Subscriber, DisconnectReason> failureHandler;
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean connected = new AtomicBoolean(true);

    private volatile long lastEnqueuedSequence = 0;
    private volatile long lastDeliveredSequence = 0;
    private volatile long sendStartedNanos = 0;

    Subscriber(ChannelKey channel,
               SubscriberConnection connection,
               int queueCapacity,
               Executor deliveryExecutor,
               BiConsumer<Subscriber, DisconnectReason> failureHandler) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    }

    public String id() {
        return connection.id();
    }

    public ChannelKey channel() {
        return channel;
    }

    public boolean isConnected() {
        return connected.get();
    }

    public long lastDeliveredSequence() {
        return lastDeliveredSequence;
    }

    public int queuedCount() {
        return queue.size();
    }

    /**
     * Queues a caption unless its sequence is not newer than the last one queued.
     */
    EnqueueResult enqueueCaption(Translation translation, boolean replay) {
        if (!connected.get() || translation.sequence() <= lastEnqueuedSequence) {
            return EnqueueResult.IGNORED;
        }
        if (!queue.offer(OutboundMessage.caption(translation, replay))) {
            return EnqueueResult.QUEUE_FULL;
        }
        lastEnqueuedSequence = translation.sequence();
        return scheduleDrain();
    }

    EnqueueResult enqueueControl(OutboundMessage message) {
        if (!connected.get()) {
            return EnqueueResult.IGNORED;
        }
        if (!queue.offer(message)) {
            return EnqueueResult.QUEUE_FULL;
        }
        return scheduleDrain();
    }

    /**
     * @return {@code true} when a send has been in progress longer than {@code timeoutNanos}
     */
    boolean isSendStalled(long nowNanos, long timeoutNanos) {
        long started = sendStartedNanos;
        return started != 0 && nowNanos - started > timeoutNanos;
    }

    /**
     * Marks the subscriber disconnected, drops queued frames and closes the transport.
     *
     * @return {@code false} when it was already disconnected
     */
    boolean disconnect(DisconnectReason reason) {
        if (!connected.compareAndSet(true, false)) {
            return false;
        }
        queue.clear();
        try {
            connection.close(reason);
        } catch (RuntimeException e) {
            LOG.warn("Closing subscriber {} on {} failed: {}", id(), channel, e.getMessage());
        }
        return true;
    }

    private EnqueueResult scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            try {
                deliveryExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                return EnqueueResult.DRAIN_REJECTED;
            }
        }
        return EnqueueResult.ACCEPTED;
    }

    private void drain() {
        ThreadContext.put("sessionId", channel.sessionId());
        ThreadContext.put("language", channel.language());
        try {
            while (true) {
                OutboundMessage next = queue.poll();
                if (next == null) {
                    draining.set(false);
                    // a frame may have been queued after poll() and before the flag was cleared
                    if (queue.isEmpty() || !draining.compareAndSet(false, true)) {
                        return;
                    }
                    continue;
                }
                if (!connected.get() || !send(next)) {
                    draining.set(false);
                    return;
                }
                if (next.type() == OutboundMessage.Type.SESSION_ENDED) {
                    disconnect(DisconnectReason.SESSION_ENDED);
                    draining.set(false);
                    return;
                }
            }
        } finally {
            ThreadContext.remove("sessionId");
            ThreadContext.remove("language");
        }
    }

    private boolean send(OutboundMessage message) {
        sendStartedNanos = System.nanoTime();
        try {
            connection.send(message);
            if (message.isCaption()) {
                lastDeliveredSequence = message.sequence();
            }
            return true;
        } catch (Exception e) {
            if (connected.get()) {
                LOG.info("Send to subscriber {} failed: {}", id(), e.getMessage());
                failureHandler.accept(this, DisconnectReason.SEND_FAILED);
            }
            return false;
        } finally {
            sendStartedNanos = 0;
        }
    }
}
