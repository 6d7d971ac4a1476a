package com.phillippitts.captionhub.config;

import com.phillippitts.captionhub.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools of the caption pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the number of concurrent sessions and languages.
 *
 * <p>All executors copy the Log4j2 ThreadContext (MDC) from the submitting thread to the
 * worker thread so {@code sessionId}/{@code language} stay attached to async logs.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for outbound translation requests.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. An attempt must never run on
     * the ingesting thread, where its timeout could not be enforced. The fan-out turns a
     * rejection into a transient {@code overloaded} failure that is retried with backoff.
     *
     * @return Configured executor for translation attempts
     */
    @Bean(name = "translationExecutor")
    public ThreadPoolTaskExecutor translationExecutor() {
        return buildExecutor(threadPoolProperties.getTranslation(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for subscriber deliveries.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A delivery must never run
     * on the releasing channel thread, so a saturated pool surfaces as a rejected drain and
     * the affected subscriber is disconnected by the hub.
     *
     * @return Configured executor for subscriber sends
     */
    @Bean(name = "deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor() {
        return buildExecutor(threadPoolProperties.getDelivery(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Scheduler for reorder slot timeouts and the stalled-subscriber sweep.
     *
     * @return Initialized task scheduler
     */
    @Bean(name = "channelScheduler")
    public ThreadPoolTaskScheduler channelScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setTaskDecorator(mdcPropagatingDecorator());
        scheduler.initialize();
        return scheduler;
    }

    private ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                 RejectedExecutionHandler rejectionHandler) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionHandler);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext into the worker and restores the worker's
     * previous context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
