package com.phillippitts.captionhub.service.persistence;

import com.phillippitts.captionhub.config.properties.PersistenceProperties;
import com.phillippitts.captionhub.domain.SessionState;
import com.phillippitts.captionhub.domain.Translation;
import com.phillippitts.captionhub.exception.PersistenceException;
import com.phillippitts.captionhub.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.captionhub.service.retry.RetryPolicy;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Asynchronous, bounded, at-least-once writer of released translations and session events.
 *
 * <p>Callers never block: {@link #submit(PersistenceRecord)} appends to an in-memory queue
 * and returns. A single writer thread drains the queue in batches.
 *
 * <p>Failure handling depends on {@link PersistenceException#isTransient()}:
 * <ul>
 *   <li><b>Transient</b> (storage unreachable, lock timeout): the batch is retried with backoff;
 *       if it still fails it is put back at the head of the queue, so records survive a
 *       storage outage until the queue overflows</li>
 *   <li><b>Permanent</b> (constraint violation): the batch is split and written one record at
 *       a time. Records storage refuses are rejected with an error log and the
 *       {@code captionhub.logger.rejected} counter; the rest of the batch is stored</li>
 * </ul>
 *
 * <p>Overflow policy: when the queue is full the <em>oldest</em> record is dropped, with a
 * warning and the {@code captionhub.logger.dropped} counter. Persistence is best effort;
 * the live caption path is never slowed down by storage.
 *
 * <p>Per-session pending counts back {@link #awaitDrained(String, Duration)} and
 * {@link #discard(String)}, used when a session ends.
 */
@Service
public class DurableLogger {

    private static final Logger LOG = LogManager.getLogger(DurableLogger.class);

    private final PersistenceSink sink;
    private final PersistenceProperties properties;
    private final RetryPolicy retryPolicy;
    private final PipelineMetricsPublisher metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition progress = lock.newCondition();
    private final Deque<PersistenceRecord> queue = new ArrayDeque<>();
    private final Map<String, Integer> pendingBySession = new HashMap<>();

    // guarded by lock
    private int inFlight = 0;
    private long droppedTotal = 0;
    private long writeFailuresTotal = 0;
    private long persistedTotal = 0;
    private long rejectedTotal = 0;
    private boolean lastBatchFailed = false;
    private Instant lastFailureAt;

    private volatile boolean running = false;
    private Thread writer;

    @Autowired
    public DurableLogger(PersistenceSink sink, PersistenceProperties properties, PipelineMetricsPublisher metrics) {
        this(sink, properties, RetryPolicy.builder()
                .maxRetries(properties.getMaxRetries())
                .baseDelay(Duration.ofMillis(properties.getBackoffBaseMs()))
                .maxDelay(Duration.ofMillis(properties.getBackoffMaxMs()))
                .retryOn(DurableLogger::isTransient)
                .build(), metrics);
    }

    public DurableLogger(PersistenceSink sink, PersistenceProperties properties, RetryPolicy retryPolicy,
                         PipelineMetricsPublisher metrics) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
    }

    @PostConstruct
    public void start() {
        if (running) {
            return;
        }
        running = true;
        writer = new Thread(this::runWriter, "persistence-writer");
        writer.setDaemon(true);
        writer.start();
        LOG.info("Durable logger started: sink={}, queueCapacity={}, batchSize={}, flushIntervalMs={}",
                sink.name(), properties.getQueueCapacity(), properties.getBatchSize(),
                properties.getFlushIntervalMs());
    }

    /**
     * Drains queued records for up to {@code persistence.drain-timeout-ms}, then stops the
     * writer. Records still queued afterwards are discarded with a warning.
     */
    @PreDestroy
    public void shutdown() {
        if (!running) {
            return;
        }
        boolean drained = awaitAllDrained(Duration.ofMillis(properties.getDrainTimeoutMs()));
        running = false;
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        writer.interrupt();
        try {
            writer.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        lock.lock();
        try {
            if (!drained || !queue.isEmpty()) {
                LOG.warn("Durable logger stopped with {} unwritten record(s); discarding", queue.size());
                queue.clear();
                pendingBySession.clear();
            } else {
                LOG.info("Durable logger stopped; all records written (persisted={})", persistedTotal);
            }
        } finally {
            lock.unlock();
        }
    }

    public void logTranslation(Translation translation) {
        submit(TranslationRecord.of(translation));
    }

    public void logSessionEvent(String sessionId, SessionState state, Instant at) {
        submit(new SessionEventRecord(sessionId, state, at));
    }

    /**
     * Queues a record without blocking. Drops the oldest queued record when full.
     */
    public void submit(PersistenceRecord record) {
        Objects.requireNonNull(record, "record");
        PersistenceRecord evicted = null;
        lock.lock();
        try {
            if (queue.size() >= properties.getQueueCapacity()) {
                evicted = queue.pollFirst();
                if (evicted != null) {
                    decrementPending(evicted.sessionId());
                    droppedTotal++;
                }
            }
            queue.addLast(record);
            pendingBySession.merge(record.sessionId(), 1, Integer::sum);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
        if (evicted != null) {
            metrics.loggerDropped(1);
            LOG.warn("Persistence queue full ({}); dropped oldest record of session {}",
                    properties.getQueueCapacity(), evicted.sessionId());
        }
    }

    /**
     * Waits until every record of {@code sessionId} submitted so far was written or dropped.
     *
     * @return {@code true} when drained within {@code timeout}
     */
    public boolean awaitDrained(String sessionId, Duration timeout) {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (pendingBySession.getOrDefault(sessionId, 0) > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = progress.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every queued record of {@code sessionId}. A batch already being written is not
     * affected.
     *
     * @return number of records discarded
     */
    public int discard(String sessionId) {
        int removed = 0;
        lock.lock();
        try {
            Iterator<PersistenceRecord> it = queue.iterator();
            while (it.hasNext()) {
                if (it.next().sessionId().equals(sessionId)) {
                    it.remove();
                    removed++;
                }
            }
            pendingBySession.remove(sessionId);
            progress.signalAll();
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            LOG.warn("Discarded {} unwritten record(s) of session {}", removed, sessionId);
        }
        return removed;
    }

    public int pendingCount(String sessionId) {
        lock.lock();
        try {
            return pendingBySession.getOrDefault(sessionId, 0);
        } finally {
            lock.unlock();
        }
    }

    public int queueSize() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Point-in-time counters for health reporting.
     */
    public Stats stats() {
        lock.lock();
        try {
            return new Stats(queue.size(), properties.getQueueCapacity(), droppedTotal, writeFailuresTotal,
                    persistedTotal, rejectedTotal, lastBatchFailed, lastFailureAt, running);
        } finally {
            lock.unlock();
        }
    }

    public record Stats(int queued, int capacity, long dropped, long writeFailures, long persisted,
                        long rejected, boolean lastBatchFailed, Instant lastFailureAt, boolean running) {
    }

    /**
     * Only failures the sink marked transient are worth another attempt.
     */
    static boolean isTransient(Throwable t) {
        return t instanceof PersistenceException pe && pe.isTransient();
    }

    private void runWriter() {
        while (running) {
            List<PersistenceRecord> batch;
            try {
                batch = nextBatch();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (batch.isEmpty()) {
                continue;
            }
            if (!writeBatch(batch)) {
                return;
            }
        }
    }

    /**
     * Blocks until records are queued, then waits up to one flush interval for a full batch.
     */
    private List<PersistenceRecord> nextBatch() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (!running) {
                    return List.of();
                }
                notEmpty.await();
            }
            long wait = TimeUnit.MILLISECONDS.toNanos(properties.getFlushIntervalMs());
            while (queue.size() < properties.getBatchSize() && wait > 0 && running) {
                wait = notEmpty.awaitNanos(wait);
            }
            int n = Math.min(properties.getBatchSize(), queue.size());
            List<PersistenceRecord> batch = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                batch.add(queue.pollFirst());
            }
            inFlight = batch.size();
            return batch;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code false} when the writer was interrupted and must stop
     */
    private boolean writeBatch(List<PersistenceRecord> batch) {
        try {
            writeWithRetry(batch);
            onWritten(batch);
            return true;
        } catch (InterruptedException e) {
            requeue(batch);
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            metrics.loggerWriteFailed();
            if (isTransient(e)) {
                LOG.error("Persisting batch of {} failed after {} attempt(s); re-queued at head",
                        batch.size(), retryPolicy.maxAttempts(), e);
                requeue(batch);
                return pauseAfterFailure();
            }
            if (batch.size() == 1) {
                reject(batch.get(0), e);
                return true;
            }
            LOG.warn("Storage refused batch of {} ({}); writing records one at a time",
                    batch.size(), e.getMessage());
            return writeEach(batch);
        }
    }

    /**
     * Writes {@code batch} record by record so one refused record cannot hold back the rest.
     */
    private boolean writeEach(List<PersistenceRecord> batch) {
        for (int i = 0; i < batch.size(); i++) {
            PersistenceRecord record = batch.get(i);
            try {
                writeWithRetry(List.of(record));
                onWritten(List.of(record));
            } catch (InterruptedException e) {
                requeue(batch.subList(i, batch.size()));
                Thread.currentThread().interrupt();
                return false;
            } catch (Exception e) {
                if (isTransient(e)) {
                    metrics.loggerWriteFailed();
                    LOG.error("Persisting record of session {} failed; re-queued {} record(s) at head",
                            record.sessionId(), batch.size() - i, e);
                    requeue(batch.subList(i, batch.size()));
                    return pauseAfterFailure();
                }
                reject(record, e);
            }
        }
        return true;
    }

    private void writeWithRetry(List<PersistenceRecord> records) throws Exception {
        retryPolicy.execute(() -> {
            sink.write(records);
            return null;
        }, (attempt, failure, delayMs) -> {
            metrics.loggerWriteFailed();
            LOG.warn("Persisting batch of {} failed (attempt {}), retrying in {} ms: {}",
                    records.size(), attempt, delayMs, failure.getMessage());
        });
    }

    private void onWritten(List<PersistenceRecord> records) {
        lock.lock();
        try {
            for (PersistenceRecord r : records) {
                decrementPending(r.sessionId());
            }
            inFlight = Math.max(0, inFlight - records.size());
            persistedTotal += records.size();
            lastBatchFailed = false;
            progress.signalAll();
        } finally {
            lock.unlock();
        }
        metrics.persisted(records.size());
    }

    private void reject(PersistenceRecord record, Exception cause) {
        lock.lock();
        try {
            decrementPending(record.sessionId());
            inFlight = Math.max(0, inFlight - 1);
            rejectedTotal++;
            lastFailureAt = Instant.now();
            progress.signalAll();
        } finally {
            lock.unlock();
        }
        metrics.loggerRejected(1);
        LOG.error("Storage refused {} of session {}; record rejected: {}",
                record.getClass().getSimpleName(), record.sessionId(), cause.getMessage());
    }

    private void requeue(List<PersistenceRecord> batch) {
        long overflow = 0;
        lock.lock();
        try {
            ListIterator<PersistenceRecord> it = batch.listIterator(batch.size());
            while (it.hasPrevious()) {
                PersistenceRecord r = it.previous();
                // records of a session discarded meanwhile are not put back
                if (pendingBySession.containsKey(r.sessionId())) {
                    queue.addFirst(r);
                }
            }
            while (queue.size() > properties.getQueueCapacity()) {
                PersistenceRecord evicted = queue.pollFirst();
                decrementPending(evicted.sessionId());
                overflow++;
            }
            droppedTotal += overflow;
            inFlight = 0;
            writeFailuresTotal++;
            lastBatchFailed = true;
            lastFailureAt = Instant.now();
            progress.signalAll();
        } finally {
            lock.unlock();
        }
        if (overflow > 0) {
            metrics.loggerDropped(overflow);
            LOG.warn("Persistence queue over capacity after re-queue; dropped {} oldest record(s)", overflow);
        }
    }

    private boolean pauseAfterFailure() {
        lock.lock();
        try {
            long wait = TimeUnit.MILLISECONDS.toNanos(properties.getBackoffMaxMs());
            while (wait > 0 && running) {
                wait = progress.awaitNanos(wait);
            }
            return running;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    private boolean awaitAllDrained(Duration timeout) {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!queue.isEmpty() || inFlight > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = progress.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void decrementPending(String sessionId) {
        pendingBySession.computeIfPresent(sessionId, (k, v) -> v <= 1 ? null : v - 1);
    }
}
