package com.phillippitts.captionhub.service.persistence;

import com.phillippitts.captionhub.domain.Translation;

import java.time.Instant;
import java.util.Objects;

/**
 * Released translation to store, next to the source text it was produced from. Keyed by
 * (sessionId, sequence, language).
 */
public record TranslationRecord(
        String sessionId,
        long sequence,
        String language,
        String outcome,
        String sourceText,
        String text,
        String failureReason,
        Instant completedAt
) implements PersistenceRecord {

    /** Width of the {@code source_text} and {@code text} columns. */
    public static final int MAX_TEXT_LENGTH = 4000;

    public TranslationRecord {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");
    }

    /**
     * Builds the record for a released translation, cutting both texts to the column width.
     */
    public static TranslationRecord of(Translation translation) {
        return new TranslationRecord(translation.sessionId(), translation.sequence(), translation.language(),
                translation.outcome().name(), truncate(translation.sourceText()), truncate(translation.text()),
                translation.failureReason(), translation.completedAt());
    }

    static String truncate(String value) {
        if (value == null || value.length() <= MAX_TEXT_LENGTH) {
            return value;
        }
        int end = Character.isHighSurrogate(value.charAt(MAX_TEXT_LENGTH - 1)) ? MAX_TEXT_LENGTH - 1 : MAX_TEXT_LENGTH;
        return value.substring(0, end);
    }
}
