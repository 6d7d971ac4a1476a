package com.phillippitts.captionhub.service.persistence;

import com.phillippitts.captionhub.config.properties.PersistenceProperties;
import com.phillippitts.captionhub.domain.SessionState;
import com.phillippitts.captionhub.domain.Translation;
import com.phillippitts.captionhub.exception.PersistenceException;
import com.phillippitts.captionhub.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.captionhub.service.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DurableLoggerTest {

    private InMemorySink sink;
    private PersistenceProperties properties;
    private DurableLogger logger;

    @BeforeEach
    void setUp() {
        sink = new InMemorySink();
        properties = new PersistenceProperties();
        properties.setQueueCapacity(100);
        properties.setBatchSize(10);
        properties.setFlushIntervalMs(20);
        properties.setBackoffMaxMs(30);
        properties.setDrainTimeoutMs(500);
    }

    @AfterEach
    void tearDown() {
        if (logger != null) {
            logger.shutdown();
        }
    }

    private DurableLogger newLogger(int maxRetries) {
        RetryPolicy policy = RetryPolicy.builder()
                .maxRetries(maxRetries)
                .baseDelay(Duration.ofMillis(1))
                .maxDelay(Duration.ofMillis(5))
                .build();
        logger = new DurableLogger(sink, properties, policy, PipelineMetricsPublisher.NOOP);
        return logger;
    }

    private static Translation fr(long seq) {
        return Translation.translated("s1", seq, "fr", "texte " + seq);
    }

    @Test
    void writesSubmittedRecordsInSubmissionOrder() {
        DurableLogger log = newLogger(0);
        log.start();
        for (long seq = 1; seq <= 25; seq++) {
            log.logTranslation(fr(seq));
        }

        assertThat(log.awaitDrained("s1", Duration.ofSeconds(5))).isTrue();
        assertThat(sink.written()).hasSize(25);
        assertThat(sink.written()).extracting(r -> ((TranslationRecord) r).sequence())
                .isSorted();
        assertThat(log.stats().persisted()).isEqualTo(25);
        assertThat(log.pendingCount("s1")).isZero();
    }

    @Test
    void submitNeverBlocksAndDropsOldestWhenFull() {
        properties.setQueueCapacity(3);
        DurableLogger log = newLogger(0);
        for (long seq = 1; seq <= 5; seq++) {
            log.logTranslation(fr(seq));
        }

        assertThat(log.queueSize()).isEqualTo(3);
        assertThat(log.stats().dropped()).isEqualTo(2);

        log.start();
        assertThat(log.awaitDrained("s1", Duration.ofSeconds(5))).isTrue();
        assertThat(sink.written()).extracting(r -> ((TranslationRecord) r).sequence())
                .containsExactly(3L, 4L, 5L);
    }

    @Test
    void transientWriteFailureIsRetried() {
        sink.failNext(2);
        DurableLogger log = newLogger(3);
        log.start();

        log.logSessionEvent("s1", SessionState.ACTIVE, Instant.now());

        assertThat(log.awaitDrained("s1", Duration.ofSeconds(5))).isTrue();
        assertThat(sink.written()).hasSize(1);
        assertThat(sink.writeCalls()).isEqualTo(3);
        assertThat(log.stats().lastBatchFailed()).isFalse();
    }

    @Test
    void batchFailingAllRetriesIsRequeuedAndWrittenLater() {
        sink.failNext(3);
        DurableLogger log = newLogger(1);
        log.start();
        log.logTranslation(fr(1));
        log.logTranslation(fr(2));

        await().atMost(Duration.ofSeconds(5)).until(() -> log.stats().writeFailures() >= 1);

        assertThat(log.awaitDrained("s1", Duration.ofSeconds(5))).isTrue();
        assertThat(sink.written()).extracting(r -> ((TranslationRecord) r).sequence())
                .containsExactly(1L, 2L);
        assertThat(log.stats().dropped()).isZero();
        assertThat(log.stats().lastBatchFailed()).isFalse();
    }

    @Test
    void refusedRecordIsRejectedWithoutBlockingOtherSessions() {
        sink.refuse(r -> r.sessionId().equals("poison"));
        logger = new DurableLogger(sink, properties, PipelineMetricsPublisher.NOOP);
        logger.start();

        logger.logTranslation(Translation.translated("poison", 1, "fr", "refused"));
        for (long seq = 1; seq <= 5; seq++) {
            logger.logTranslation(Translation.translated("other", seq, "fr", "texte " + seq));
        }

        assertThat(logger.awaitDrained("other", Duration.ofSeconds(5))).isTrue();
        assertThat(logger.awaitDrained("poison", Duration.ofSeconds(5))).isTrue();
        assertThat(sink.written()).extracting(PersistenceRecord::sessionId).containsOnly("other").hasSize(5);
        DurableLogger.Stats stats = logger.stats();
        assertThat(stats.rejected()).isEqualTo(1);
        assertThat(stats.persisted()).isEqualTo(5);
        assertThat(stats.queued()).isZero();
    }

    @Test
    void permanentFailureIsNotRetried() {
        sink.refuse(r -> true);
        logger = new DurableLogger(sink, properties, PipelineMetricsPublisher.NOOP);
        logger.start();

        logger.logSessionEvent("s1", SessionState.ACTIVE, Instant.now());

        assertThat(logger.awaitDrained("s1", Duration.ofSeconds(5))).isTrue();
        assertThat(sink.writeCalls()).isEqualTo(1);
        assertThat(logger.stats().rejected()).isEqualTo(1);
    }

    @Test
    void classifiesOnlyTransientStorageFailuresAsRetryable() {
        assertThat(DurableLogger.isTransient(new PersistenceException("down", 1, null, true))).isTrue();
        assertThat(DurableLogger.isTransient(new PersistenceException("constraint", 1, null, false))).isFalse();
        assertThat(DurableLogger.isTransient(new IllegalStateException("bug"))).isFalse();
    }

    @Test
    void awaitDrainedTimesOutWhileStorageIsDown() {
        sink.failNext(Integer.MAX_VALUE);
        DurableLogger log = newLogger(0);
        log.start();
        log.logTranslation(fr(1));

        assertThat(log.awaitDrained("s1", Duration.ofMillis(200))).isFalse();
        await().atMost(Duration.ofSeconds(2)).until(() -> log.stats().lastBatchFailed());
        assertThat(log.stats().lastFailureAt()).isNotNull();
    }

    @Test
    void discardRemovesOnlyThatSessionsRecords() {
        DurableLogger log = newLogger(0);
        log.logTranslation(fr(1));
        log.logTranslation(Translation.translated("s2", 1, "de", "Hallo"));
        log.logSessionEvent("s1", SessionState.ENDED, null);

        assertThat(log.discard("s1")).isEqualTo(2);
        assertThat(log.pendingCount("s1")).isZero();
        assertThat(log.pendingCount("s2")).isEqualTo(1);
        assertThat(log.awaitDrained("s1", Duration.ZERO)).isTrue();
    }

    @Test
    void shutdownDiscardsRecordsThatCannotBeWritten() {
        sink.failNext(Integer.MAX_VALUE);
        properties.setDrainTimeoutMs(100);
        DurableLogger log = newLogger(0);
        log.start();
        log.logTranslation(fr(1));

        log.shutdown();

        assertThat(log.stats().running()).isFalse();
        assertThat(log.queueSize()).isZero();
        assertThat(sink.written()).isEmpty();
    }
}
