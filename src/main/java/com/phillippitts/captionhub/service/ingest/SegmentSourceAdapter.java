package com.phillippitts.captionhub.service.ingest;

import com.phillippitts.captionhub.domain.SegmentEvent;
import com.phillippitts.captionhub.domain.SessionState;
import com.phillippitts.captionhub.domain.TranscriptSegment;
import com.phillippitts.captionhub.exception.SessionNotFoundException;
import com.phillippitts.captionhub.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.captionhub.service.session.SessionOrchestrator;
import com.phillippitts.captionhub.service.session.SessionStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Normalizes raw transcript events into {@link TranscriptSegment}s for the session pipeline.
 *
 * <ul>
 *   <li>Partials are dropped</li>
 *   <li>Malformed events are rejected and never retried</li>
 *   <li>A sequence not greater than the session's last accepted sequence is rejected; the
 *       pipeline does not reorder at this boundary. Gaps are accepted.</li>
 * </ul>
 *
 * <p>Per-session tracking is released when the session ends.
 */
@Component
public class SegmentSourceAdapter {

    private static final Logger LOG = LogManager.getLogger(SegmentSourceAdapter.class);

    private final SessionOrchestrator orchestrator;
    private final PipelineMetricsPublisher metrics;
    private final ConcurrentMap<String, Long> lastAccepted = new ConcurrentHashMap<>();

    public SegmentSourceAdapter(SessionOrchestrator orchestrator, PipelineMetricsPublisher metrics) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
    }

    public IngestResult accept(SegmentEvent event) {
        if (event == null) {
            return reject(IngestResult.REJECTED_INVALID, null, 0, "null event");
        }
        if (!event.isFinal()) {
            LOG.debug("Dropping partial seq={} for session {}", event.sequence(), event.sessionId());
            return IngestResult.DROPPED_PARTIAL;
        }
        String invalid = validate(event);
        if (invalid != null) {
            return reject(IngestResult.REJECTED_INVALID, event.sessionId(), event.sequence(), invalid);
        }
        TranscriptSegment segment = new TranscriptSegment(event.sessionId(), event.sequence(),
                event.text(), event.timestamp());

        // claim the sequence first so two concurrent events cannot both pass the check
        AtomicBoolean monotonic = new AtomicBoolean(false);
        AtomicReference<Long> previous = new AtomicReference<>();
        lastAccepted.compute(segment.sessionId(), (id, last) -> {
            previous.set(last);
            if (last == null || segment.sequence() > last) {
                monotonic.set(true);
                return segment.sequence();
            }
            return last;
        });
        if (!monotonic.get()) {
            LOG.warn("Out-of-order segment seq={} for session {} (last accepted {})",
                    segment.sequence(), segment.sessionId(), lastAccepted.get(segment.sessionId()));
            metrics.ingestRejected(IngestResult.REJECTED_OUT_OF_ORDER.tag());
            return IngestResult.REJECTED_OUT_OF_ORDER;
        }

        try {
            if (orchestrator.submitSegment(segment)) {
                return IngestResult.ACCEPTED;
            }
            release(segment, previous.get());
            return reject(IngestResult.REJECTED_SESSION_INACTIVE, segment.sessionId(), segment.sequence(),
                    "session not active");
        } catch (SessionNotFoundException e) {
            release(segment, previous.get());
            return reject(IngestResult.REJECTED_UNKNOWN_SESSION, segment.sessionId(), segment.sequence(),
                    "unknown session");
        }
    }

    /**
     * @return last accepted sequence for the session, or 0 when none
     */
    public long lastAcceptedSequence(String sessionId) {
        return lastAccepted.getOrDefault(sessionId, 0L);
    }

    @EventListener
    public void onSessionStateChanged(SessionStateChangedEvent event) {
        if (event.session().state() == SessionState.ENDED) {
            lastAccepted.remove(event.session().id());
        }
    }

    /**
     * Gives back a claimed sequence whose segment did not enter the pipeline.
     */
    private void release(TranscriptSegment segment, Long previous) {
        lastAccepted.computeIfPresent(segment.sessionId(),
                (id, last) -> last == segment.sequence() ? previous : last);
    }

    private IngestResult reject(IngestResult result, String sessionId, long sequence, String reason) {
        LOG.info("Rejected segment seq={} for session {}: {}", sequence, sessionId, reason);
        metrics.ingestRejected(result.tag());
        return result;
    }

    private static String validate(SegmentEvent event) {
        if (event.sessionId() == null || event.sessionId().isBlank()) {
            return "missing session id";
        }
        if (event.sequence() < 1) {
            return "sequence must be >= 1";
        }
        if (event.text() == null || event.text().isBlank()) {
            return "blank text";
        }
        return null;
    }
}
