package com.phillippitts.captionhub.service.broadcast;

import com.phillippitts.captionhub.config.properties.BroadcastProperties;
import com.phillippitts.captionhub.config.properties.ReorderProperties;
import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.Translation;
import com.phillippitts.captionhub.exception.ChannelNotFoundException;
import com.phillippitts.captionhub.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.captionhub.service.translation.TranslationSink;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry of open caption channels and their subscribers.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Opens and closes one {@link Channel} per (session, target language)</li>
 *   <li>Routes completed translations into their channel ({@link #deliver(Translation)})</li>
 *   <li>Registers subscribers with backlog replay and resume-after-sequence</li>
 *   <li>Disconnects subscribers that overflow, fail or stall; a slow subscriber never
 *       delays the channel or its other subscribers</li>
 * </ul>
 *
 * <p><b>Thread Model:</b> channel state changes under each channel's own lock; subscriber
 * sends run on {@code deliveryExecutor}; stall timers and the send-timeout sweep run on
 * {@code channelScheduler}.
 */
@Service
public class BroadcastHub implements TranslationSink {

    private static final Logger LOG = LogManager.getLogger(BroadcastHub.class);

    private final ConcurrentMap<ChannelKey, Channel> channels = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Subscriber> subscribersById = new ConcurrentHashMap<>();
    private final BroadcastProperties broadcastProperties;
    private final ReorderProperties reorderProperties;
    private final Executor deliveryExecutor;
    private final TaskScheduler scheduler;
    private final PipelineMetricsPublisher metrics;

    private ScheduledFuture<?> sweepTask;

    public BroadcastHub(BroadcastProperties broadcastProperties,
                        ReorderProperties reorderProperties,
                        @Qualifier("deliveryExecutor") Executor deliveryExecutor,
                        @Qualifier("channelScheduler") TaskScheduler scheduler,
                        PipelineMetricsPublisher metrics) {
        this.broadcastProperties = Objects.requireNonNull(broadcastProperties, "broadcastProperties");
        this.reorderProperties = Objects.requireNonNull(reorderProperties, "reorderProperties");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
    }

    @PostConstruct
    void startSweep() {
        Duration interval = Duration.ofMillis(broadcastProperties.getSweepIntervalMs());
        sweepTask = scheduler.scheduleAtFixedRate(this::sweepStalledSubscribers, interval);
        LOG.info("Broadcast hub ready: backlog={}, queueCapacity={}, sendTimeoutMs={}, slotTimeoutMs={}",
                broadcastProperties.getBacklogSize(), broadcastProperties.getSubscriberQueueCapacity(),
                broadcastProperties.getSendTimeoutMs(), reorderProperties.getSlotTimeoutMs());
    }

    @PreDestroy
    void shutdown() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        for (ChannelKey key : List.copyOf(channels.keySet())) {
            closeChannel(key);
        }
    }

    /**
     * Opens the channel for {@code key}.
     *
     * @param releaseListener observes every released translation in order
     * @throws IllegalStateException when the channel is already open
     */
    public Channel openChannel(ChannelKey key, ReleaseListener releaseListener) {
        Channel channel = new Channel(key,
                reorderProperties.getMaxPending(),
                broadcastProperties.getBacklogSize(),
                Duration.ofMillis(reorderProperties.getSlotTimeoutMs()),
                scheduler,
                releaseListener,
                metrics,
                this::disconnect);
        if (channels.putIfAbsent(key, channel) != null) {
            throw new IllegalStateException("Channel already open: " + key);
        }
        LOG.debug("Opened channel {}", key);
        return channel;
    }

    /**
     * Flushes and closes the channel. Subscribers receive a session-ended frame after any
     * remaining captions and are then disconnected. No-op for unknown channels.
     */
    public void closeChannel(ChannelKey key) {
        Channel channel = channels.remove(key);
        if (channel == null) {
            return;
        }
        List<Channel.Eviction> evictions = channel.close();
        subscribersById.values().removeIf(s -> s.channel().equals(key));
        evictAll(evictions);
        LOG.debug("Closed channel {}", key);
    }

    /**
     * Routes a terminal translation to its channel. Translations for channels that are not
     * open are dropped.
     */
    @Override
    public void onTranslation(Translation translation) {
        deliver(translation);
    }

    public void deliver(Translation translation) {
        Channel channel = channels.get(translation.channel());
        if (channel == null) {
            LOG.debug("No open channel for {}, dropping seq={}", translation.channel(), translation.sequence());
            return;
        }
        evictAll(channel.accept(translation));
    }

    /**
     * Registers a subscriber: replays the backlog (only entries after {@code lastSequence}
     * when given) and then joins live delivery.
     *
     * @throws ChannelNotFoundException when the channel is not open
     */
    public Subscriber subscribe(ChannelKey key, SubscriberConnection connection, Long lastSequence) {
        Channel channel = channels.get(key);
        if (channel == null) {
            throw new ChannelNotFoundException(key);
        }
        Subscriber subscriber = new Subscriber(key, connection,
                broadcastProperties.getSubscriberQueueCapacity(), deliveryExecutor, this::disconnect);
        subscribersById.put(subscriber.id(), subscriber);
        int replayed = channel.subscribe(subscriber, lastSequence);
        if (replayed < 0) {
            subscribersById.remove(subscriber.id(), subscriber);
            if (channel.isClosed()) {
                subscriber.disconnect(DisconnectReason.SESSION_ENDED);
                throw new ChannelNotFoundException(key);
            }
            disconnect(subscriber, DisconnectReason.QUEUE_OVERFLOW);
            return subscriber;
        }
        LOG.info("Subscriber {} joined {} (replayed={}, lastSequence={})",
                subscriber.id(), key, replayed, lastSequence);
        return subscriber;
    }

    /**
     * Removes a subscriber whose client went away. Unknown ids are ignored.
     */
    public void unsubscribe(String subscriberId) {
        Subscriber subscriber = subscribersById.get(subscriberId);
        if (subscriber != null) {
            disconnect(subscriber, DisconnectReason.CLIENT_CLOSED);
        }
    }

    /**
     * Removes the subscriber from its channel and closes its connection. Idempotent.
     */
    public void disconnect(Subscriber subscriber, DisconnectReason reason) {
        subscribersById.remove(subscriber.id(), subscriber);
        Channel channel = channels.get(subscriber.channel());
        if (channel != null) {
            channel.remove(subscriber);
        }
        if (subscriber.disconnect(reason)) {
            metrics.subscriberDisconnected(reason.tag());
            if (reason == DisconnectReason.CLIENT_CLOSED || reason == DisconnectReason.SESSION_ENDED) {
                LOG.info("Subscriber {} left {} ({})", subscriber.id(), subscriber.channel(), reason.tag());
            } else {
                LOG.warn("Disconnected subscriber {} from {}: {}", subscriber.id(), subscriber.channel(), reason.tag());
            }
        }
    }

    /**
     * Disconnects subscribers whose current send has exceeded the send timeout.
     */
    public void sweepStalledSubscribers() {
        long now = System.nanoTime();
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(broadcastProperties.getSendTimeoutMs());
        for (Channel channel : channels.values()) {
            for (Subscriber stalled : channel.stalledSubscribers(now, timeoutNanos)) {
                disconnect(stalled, DisconnectReason.SEND_TIMEOUT);
            }
        }
    }

    public Optional<Channel> channel(ChannelKey key) {
        return Optional.ofNullable(channels.get(key));
    }

    public boolean isOpen(ChannelKey key) {
        return channels.containsKey(key);
    }

    public int subscriberCount(ChannelKey key) {
        Channel channel = channels.get(key);
        return channel == null ? 0 : channel.subscriberCount();
    }

    /**
     * @return subscriber count per target language of the session, in the given order
     */
    public Map<String, Integer> subscriberCounts(String sessionId, List<String> languages) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String language : languages) {
            counts.put(language, subscriberCount(new ChannelKey(sessionId, language)));
        }
        return counts;
    }

    public int totalSubscribers() {
        return subscribersById.size();
    }

    public int openChannelCount() {
        return channels.size();
    }

    private void evictAll(List<Channel.Eviction> evictions) {
        for (Channel.Eviction e : evictions) {
            disconnect(e.subscriber(), e.reason());
        }
    }
}
