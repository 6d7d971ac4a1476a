package com.phillippitts.captionhub.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal outcome for one (segment, language) pair.
 *
 * <p>Exactly one translation is produced per pair. A {@code FAILED} or {@code SKIPPED}
 * translation still occupies its sequence slot in the channel so ordering is preserved and
 * subscribers see an explicit marker instead of a gap.
 *
 * <p>A skip marker normally covers its own slot only. When the reorder buffer collapses a
 * wide gap into one marker, {@code skippedFrom} is the first slot of the gap and
 * {@code sequence} the last.
 *
 * @param sessionId     owning session
 * @param sequence      segment sequence number
 * @param language      target language code
 * @param outcome       terminal outcome
 * @param text          translated text; {@code null} unless {@link Outcome#TRANSLATED}
 * @param failureReason short reason for failure or skip; {@code null} when translated
 * @param completedAt   when the outcome was decided
 * @param sourceText    source segment text; {@code null} for skip markers
 * @param skippedFrom   first sequence covered by this outcome; equals {@code sequence}
 *                      unless a wider gap was collapsed
 */
public record Translation(
        String sessionId,
        long sequence,
        String language,
        Outcome outcome,
        String text,
        String failureReason,
        Instant completedAt,
        String sourceText,
        long skippedFrom
) {

    public enum Outcome {
        /** Translation succeeded. */
        TRANSLATED,
        /** Translation failed permanently (non-transient error, retries exhausted or cancelled). */
        FAILED,
        /** Slot never arrived in the channel and was skipped by the reorder buffer. */
        SKIPPED
    }

    public Translation {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");
        if (outcome == Outcome.TRANSLATED) {
            Objects.requireNonNull(text, "text must not be null for a translated outcome");
        }
        if (skippedFrom == 0) {
            skippedFrom = sequence;
        }
        if (skippedFrom > sequence || (skippedFrom < sequence && outcome != Outcome.SKIPPED)) {
            throw new IllegalArgumentException("skippedFrom " + skippedFrom + " invalid for "
                    + outcome + " at sequence " + sequence);
        }
    }

    public Translation(String sessionId, long sequence, String language, Outcome outcome, String text,
                       String failureReason, Instant completedAt) {
        this(sessionId, sequence, language, outcome, text, failureReason, completedAt, null, sequence);
    }

    public static Translation translated(String sessionId, long sequence, String language, String text) {
        return new Translation(sessionId, sequence, language, Outcome.TRANSLATED, text, null, Instant.now());
    }

    public static Translation translated(TranscriptSegment segment, String language, String text) {
        return new Translation(segment.sessionId(), segment.sequence(), language, Outcome.TRANSLATED, text,
                null, Instant.now(), segment.text(), segment.sequence());
    }

    public static Translation failed(String sessionId, long sequence, String language, String reason) {
        return new Translation(sessionId, sequence, language, Outcome.FAILED, null, reason, Instant.now());
    }

    public static Translation failed(TranscriptSegment segment, String language, String reason) {
        return new Translation(segment.sessionId(), segment.sequence(), language, Outcome.FAILED, null,
                reason, Instant.now(), segment.text(), segment.sequence());
    }

    public static Translation skipped(ChannelKey channel, long sequence, String reason) {
        return skippedRange(channel, sequence, sequence, reason);
    }

    /**
     * One marker standing for every slot in {@code [from, to]}.
     */
    public static Translation skippedRange(ChannelKey channel, long from, long to, String reason) {
        return new Translation(channel.sessionId(), to, channel.language(), Outcome.SKIPPED,
                null, reason, Instant.now(), null, from);
    }

    /**
     * Returns {@code true} for failure and skip markers, which subscribers render as skipped.
     */
    public boolean isMarker() {
        return outcome != Outcome.TRANSLATED;
    }

    /**
     * @return number of sequence slots this outcome accounts for
     */
    public long slotsCovered() {
        return sequence - skippedFrom + 1;
    }

    public ChannelKey channel() {
        return new ChannelKey(sessionId, language);
    }
}
