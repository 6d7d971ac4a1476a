package com.phillippitts.captionhub.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the broadcast hub.
 */
@Validated
@ConfigurationProperties(prefix = "broadcast")
public class BroadcastProperties {

    /** Number of recent captions replayed to a late-joining subscriber. */
    @PositiveOrZero
    private int backlogSize = 20;

    /** Outbound messages buffered per subscriber before it is disconnected. */
    @Positive
    private int subscriberQueueCapacity = 64;

    /** A single send taking longer than this disconnects the subscriber. */
    @Positive
    private long sendTimeoutMs = 5000;

    /** Interval of the stalled-send sweep. */
    @Positive
    private long sweepIntervalMs = 1000;

    public int getBacklogSize() {
        return backlogSize;
    }

    public void setBacklogSize(int backlogSize) {
        this.backlogSize = backlogSize;
    }

    public int getSubscriberQueueCapacity() {
        return subscriberQueueCapacity;
    }

    public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
        this.subscriberQueueCapacity = subscriberQueueCapacity;
    }

    public long getSendTimeoutMs() {
        return sendTimeoutMs;
    }

    public void setSendTimeoutMs(long sendTimeoutMs) {
        this.sendTimeoutMs = sendTimeoutMs;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }
}
