package com.phillippitts.captionhub.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for per-channel reorder buffers.
 */
@Validated
@ConfigurationProperties(prefix = "reorder")
public class ReorderProperties {

    /**
     * How long a missing slot may hold back later translations before it is skipped.
     * Should exceed the worst-case translation time (timeout × attempts + backoff).
     */
    @Positive(message = "Slot timeout must be positive")
    private long slotTimeoutMs = 15_000;

    /** Maximum number of out-of-order translations held per channel. */
    @Positive(message = "Max pending must be positive")
    private int maxPending = 64;

    public long getSlotTimeoutMs() {
        return slotTimeoutMs;
    }

    public void setSlotTimeoutMs(long slotTimeoutMs) {
        this.slotTimeoutMs = slotTimeoutMs;
    }

    public int getMaxPending() {
        return maxPending;
    }

    public void setMaxPending(int maxPending) {
        this.maxPending = maxPending;
    }
}
