package com.phillippitts.captionhub.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized Micrometer instrumentation for the caption pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Translation latency, outcomes and retries per language</li>
 *   <li>Reorder skips, late arrivals and released captions</li>
 *   <li>Subscriber disconnects by reason</li>
 *   <li>Ingest rejections and durable logger writes/drops</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    static final String METRIC_PREFIX = "captionhub";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTranslationLatency(String language, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".translation.latency")
                .description("Time from fan-out dispatch to terminal translation outcome")
                .tag("language", language)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementTranslationSuccess(String language) {
        Counter.builder(METRIC_PREFIX + ".translation.success")
                .description("Translations that completed successfully")
                .tag("language", language)
                .register(registry)
                .increment();
    }

    /**
     * @param language target language
     * @param kind failure classification (timeout, rate_limited, invalid_input, ...)
     */
    public void incrementTranslationFailure(String language, String kind) {
        Counter.builder(METRIC_PREFIX + ".translation.failure")
                .description("Translations that ended as failure markers")
                .tag("language", language)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void incrementTranslationRetry(String language, String kind) {
        Counter.builder(METRIC_PREFIX + ".translation.retry")
                .description("Translation attempts retried after a transient failure")
                .tag("language", language)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * @param reason why the slot was skipped (timeout, overflow, flush)
     */
    public void incrementSlotSkipped(String reason) {
        Counter.builder(METRIC_PREFIX + ".reorder.skipped")
                .description("Reorder slots resolved with a synthetic skip marker")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementLateArrival() {
        Counter.builder(METRIC_PREFIX + ".reorder.late")
                .description("Translations dropped because their slot was already released")
                .register(registry)
                .increment();
    }

    public void incrementReleased(String language) {
        Counter.builder(METRIC_PREFIX + ".captions.released")
                .description("Captions released in order to subscribers")
                .tag("language", language)
                .register(registry)
                .increment();
    }

    public void incrementSubscriberDisconnected(String reason) {
        Counter.builder(METRIC_PREFIX + ".subscriber.disconnected")
                .description("Subscribers removed from the hub")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementIngestRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".ingest.rejected")
                .description("Transcript events rejected at the ingestion boundary")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementLoggerDropped(long count) {
        Counter.builder(METRIC_PREFIX + ".logger.dropped")
                .description("Persistence records dropped because the logger queue overflowed or drain timed out")
                .register(registry)
                .increment(count);
    }

    public void incrementLoggerRejected(long count) {
        Counter.builder(METRIC_PREFIX + ".logger.rejected")
                .description("Persistence records storage refused permanently and the logger gave up on")
                .register(registry)
                .increment(count);
    }

    public void incrementLoggerWriteFailure() {
        Counter.builder(METRIC_PREFIX + ".logger.write.failure")
                .description("Failed persistence batch attempts")
                .register(registry)
                .increment();
    }

    public void incrementPersisted(long count) {
        Counter.builder(METRIC_PREFIX + ".logger.persisted")
                .description("Persistence records written to storage")
                .register(registry)
                .increment(count);
    }
}
