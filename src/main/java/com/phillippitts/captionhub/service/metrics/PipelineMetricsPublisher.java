package com.phillippitts.captionhub.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link PipelineMetrics} used by every pipeline component.
 *
 * <p>Components depend on this publisher rather than on Micrometer directly so they can be
 * constructed in unit tests with {@link #NOOP}.
 *
 * @see PipelineMetrics
 */
@Component
public final class PipelineMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PipelineMetricsPublisher.class);

    /**
     * No-op instance for tests and for components built outside the Spring context.
     */
    public static final PipelineMetricsPublisher NOOP = new PipelineMetricsPublisher(null);

    private final PipelineMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public PipelineMetricsPublisher(PipelineMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PipelineMetricsPublisher created without metrics (test mode)");
        }
    }

    public void translationSucceeded(String language, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordTranslationLatency(language, durationNanos);
        metrics.incrementTranslationSuccess(language);
    }

    public void translationFailed(String language, long durationNanos, String kind) {
        if (metrics == null) {
            return;
        }
        metrics.recordTranslationLatency(language, durationNanos);
        metrics.incrementTranslationFailure(language, kind);
    }

    public void translationRetried(String language, String kind) {
        if (metrics != null) {
            metrics.incrementTranslationRetry(language, kind);
        }
    }

    public void slotSkipped(String reason) {
        if (metrics != null) {
            metrics.incrementSlotSkipped(reason);
        }
    }

    public void lateArrival() {
        if (metrics != null) {
            metrics.incrementLateArrival();
        }
    }

    public void released(String language) {
        if (metrics != null) {
            metrics.incrementReleased(language);
        }
    }

    public void subscriberDisconnected(String reason) {
        if (metrics != null) {
            metrics.incrementSubscriberDisconnected(reason);
        }
    }

    public void ingestRejected(String reason) {
        if (metrics != null) {
            metrics.incrementIngestRejected(reason);
        }
    }

    public void loggerDropped(long count) {
        if (metrics != null && count > 0) {
            metrics.incrementLoggerDropped(count);
        }
    }

    public void loggerRejected(long count) {
        if (metrics != null && count > 0) {
            metrics.incrementLoggerRejected(count);
        }
    }

    public void loggerWriteFailed() {
        if (metrics != null) {
            metrics.incrementLoggerWriteFailure();
        }
    }

    public void persisted(long count) {
        if (metrics != null && count > 0) {
            metrics.incrementPersisted(count);
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
