package com.phillippitts.captionhub.config;

import com.phillippitts.captionhub.service.broadcast.BroadcastHub;
import com.phillippitts.captionhub.service.persistence.DurableLogger;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes pipeline pool and queue gauges via Micrometer.
 *
 * <ul>
 *   <li>captionhub.pool.{size,active,queued} tagged {@code pool=translation|delivery}</li>
 *   <li>captionhub.subscribers - live subscribers across all channels</li>
 *   <li>captionhub.channels - open channels</li>
 *   <li>captionhub.logger.queued - records waiting for the persistence writer</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> translationExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> deliveryExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("translationExecutor") ObjectProvider<ThreadPoolTaskExecutor> translationExecutorProvider,
            @Qualifier("deliveryExecutor") ObjectProvider<ThreadPoolTaskExecutor> deliveryExecutorProvider) {
        this.translationExecutorProvider = translationExecutorProvider;
        this.deliveryExecutorProvider = deliveryExecutorProvider;
    }

    @Bean
    public MeterBinder pipelinePoolMetrics() {
        return registry -> {
            bindPool(registry, "translation", translationExecutorProvider.getObject().getThreadPoolExecutor());
            bindPool(registry, "delivery", deliveryExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Pipeline pool metrics registered: captionhub.pool.* available via /actuator/metrics");
        };
    }

    @Bean
    public MeterBinder pipelineQueueMetrics(BroadcastHub hub, DurableLogger durableLogger) {
        return registry -> {
            Gauge.builder("captionhub.subscribers", hub, BroadcastHub::totalSubscribers)
                    .description("Live caption subscribers across all channels")
                    .register(registry);
            Gauge.builder("captionhub.channels", hub, BroadcastHub::openChannelCount)
                    .description("Open caption channels")
                    .register(registry);
            Gauge.builder("captionhub.logger.queued", durableLogger, DurableLogger::queueSize)
                    .description("Records waiting for the persistence writer")
                    .register(registry);
        };
    }

    private static void bindPool(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("captionhub.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("captionhub.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("captionhub.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);
    }

    /**
     * Logs pool health every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        log("translation", translationExecutorProvider.getObject().getThreadPoolExecutor());
        log("delivery", deliveryExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void log(String pool, ThreadPoolExecutor executor) {
        LOG.info("{} pool health: size={}/{}, active={}, queued={}, completed={}",
                pool,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
