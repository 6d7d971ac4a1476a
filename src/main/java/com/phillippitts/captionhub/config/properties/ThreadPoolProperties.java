package com.phillippitts.captionhub.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the translation executor (outbound LLM calls), the
 * delivery executor (subscriber sends) and the channel scheduler (reorder slot timers and
 * slow-subscriber sweeps).
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private PoolProperties translation = new PoolProperties(8, 32, 500, "translate-pool-");
    @Valid
    private PoolProperties delivery = new PoolProperties(4, 16, 1000, "deliver-pool-");
    @Valid
    private SchedulerProperties scheduler = new SchedulerProperties();

    public PoolProperties getTranslation() {
        return translation;
    }

    public void setTranslation(PoolProperties translation) {
        this.translation = translation;
    }

    public PoolProperties getDelivery() {
        return delivery;
    }

    public void setDelivery(PoolProperties delivery) {
        this.delivery = delivery;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Executor pool configuration.
     */
    public static class PoolProperties {
        @Positive
        private int corePoolSize;
        @Positive
        private int maxPoolSize;
        @PositiveOrZero
        private int queueCapacity;
        @PositiveOrZero
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix;

        public PoolProperties() {
            this(4, 8, 100, "pool-");
        }

        public PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Channel scheduler configuration.
     */
    public static class SchedulerProperties {
        @Positive
        private int poolSize = 2;
        @NotBlank
        private String threadNamePrefix = "channel-timer-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
