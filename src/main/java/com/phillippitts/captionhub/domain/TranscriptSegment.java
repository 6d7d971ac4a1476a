package com.phillippitts.captionhub.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One finalized unit of source-language text.
 *
 * <p>Only final transcript events become segments; partial hypotheses are dropped at the
 * ingestion boundary and never enter the pipeline.
 *
 * @param sessionId owning session
 * @param sequence  per-session sequence number, starting at 1
 * @param text      source text (never blank)
 * @param timestamp emission time reported by the speech-to-text source
 */
public record TranscriptSegment(
        String sessionId,
        long sequence,
        String text,
        Instant timestamp
) {

    public TranscriptSegment {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1, got: " + sequence);
        }
        if (text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
