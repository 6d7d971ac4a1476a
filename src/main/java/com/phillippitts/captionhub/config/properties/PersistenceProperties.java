package com.phillippitts.captionhub.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the durable logger.
 */
@Validated
@ConfigurationProperties(prefix = "persistence")
public class PersistenceProperties {

    /** Records held in memory before the oldest are dropped. */
    @Positive
    private int queueCapacity = 10_000;

    /** Maximum records written per batch. */
    @Positive
    private int batchSize = 100;

    /** How long the writer waits for more records before flushing a partial batch. */
    @Positive
    private long flushIntervalMs = 200;

    /** Retries per batch after the first attempt. */
    @PositiveOrZero
    private int maxRetries = 5;

    @Positive
    private long backoffBaseMs = 200;

    @Positive
    private long backoffMaxMs = 5000;

    /** Bounded wait for queued writes at session end and shutdown. */
    @Positive
    private long drainTimeoutMs = 5000;

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getFlushIntervalMs() {
        return flushIntervalMs;
    }

    public void setFlushIntervalMs(long flushIntervalMs) {
        this.flushIntervalMs = flushIntervalMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public void setBackoffBaseMs(long backoffBaseMs) {
        this.backoffBaseMs = backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public void setBackoffMaxMs(long backoffMaxMs) {
        this.backoffMaxMs = backoffMaxMs;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }
}
