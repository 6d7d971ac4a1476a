package com.phillippitts.captionhub.domain;

import java.time.Instant;

/**
 * Raw transcript event as emitted by the external speech-to-text stream.
 *
 * <p>Fields are not validated here; the segment source adapter decides whether the event
 * becomes a {@link TranscriptSegment}.
 */
public record SegmentEvent(
        String sessionId,
        long sequence,
        String text,
        boolean isFinal,
        Instant timestamp
) {
}
