package com.phillippitts.captionhub.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a caption session.
 *
 * <p>The session orchestrator owns sessions exclusively and replaces the snapshot on
 * every lifecycle transition and accepted segment; callers only ever see consistent
 * point-in-time views.
 *
 * @param id              session identifier
 * @param sourceLanguage  language code of the incoming transcript
 * @param targetLanguages language codes to translate into, in configured order
 * @param state           current lifecycle state
 * @param createdAt       creation time
 * @param startedAt       time the session became active, or {@code null}
 * @param endedAt         time the session ended, or {@code null}
 * @param loggingEnabled  whether released translations are persisted
 * @param transcriptCount final segments accepted for translation so far
 */
public record Session(
        String id,
        String sourceLanguage,
        List<String> targetLanguages,
        SessionState state,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        boolean loggingEnabled,
        long transcriptCount
) {

    public Session {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        targetLanguages = List.copyOf(targetLanguages);
        if (targetLanguages.isEmpty()) {
            throw new IllegalArgumentException("targetLanguages must not be empty");
        }
        if (transcriptCount < 0) {
            throw new IllegalArgumentException("transcriptCount must be >= 0, got: " + transcriptCount);
        }
    }

    /**
     * Creates a new session in {@link SessionState#CREATED}.
     */
    public static Session created(String id, String sourceLanguage, List<String> targetLanguages,
                                  boolean loggingEnabled) {
        return new Session(id, sourceLanguage, targetLanguages, SessionState.CREATED,
                Instant.now(), null, null, loggingEnabled, 0);
    }

    public Session activated(Instant at) {
        return new Session(id, sourceLanguage, targetLanguages, SessionState.ACTIVE,
                createdAt, at, null, loggingEnabled, transcriptCount);
    }

    public Session ended(Instant at) {
        return new Session(id, sourceLanguage, targetLanguages, SessionState.ENDED,
                createdAt, startedAt, at, loggingEnabled, transcriptCount);
    }

    /**
     * @return this snapshot with one more accepted segment
     */
    public Session withTranscript() {
        return new Session(id, sourceLanguage, targetLanguages, state,
                createdAt, startedAt, endedAt, loggingEnabled, transcriptCount + 1);
    }

    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }
}
