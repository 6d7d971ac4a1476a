package com.phillippitts.captionhub.config;

import com.phillippitts.captionhub.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateTranslationExecutorThatRejectsWhenSaturated() {
        ThreadPoolTaskExecutor executor = config.translationExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(8);
            assertThat(executor.getMaxPoolSize()).isEqualTo(32);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("translate-pool-");
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateDeliveryExecutorThatAbortsWhenSaturated() {
        ThreadPoolTaskExecutor executor = config.deliveryExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(4);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("deliver-pool-");
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateInitializedScheduler() {
        ThreadPoolTaskScheduler scheduler = config.channelScheduler();
        try {
            assertThat(scheduler.getScheduledThreadPoolExecutor()).isNotNull();
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(2);
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.translationExecutor();
        int taskCount = 20;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        try {
            for (int i = 0; i < taskCount; i++) {
                executor.execute(() -> {
                    try {
                        Thread.sleep(5);
                        completedTasks.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(completedTasks.get()).isEqualTo(taskCount);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void decoratorCopiesSubmitterContextAndRestoresWorkerContext() {
        TaskDecorator decorator = ThreadPoolConfig.mdcPropagatingDecorator();
        AtomicReference<String> seen = new AtomicReference<>();

        ThreadContext.put("sessionId", "s1");
        Runnable decorated = decorator.decorate(() -> seen.set(ThreadContext.get("sessionId")));
        ThreadContext.clearAll();
        ThreadContext.put("worker", "w1");

        decorated.run();

        assertThat(seen.get()).isEqualTo("s1");
        assertThat(ThreadContext.get("sessionId")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("w1");
    }
}
