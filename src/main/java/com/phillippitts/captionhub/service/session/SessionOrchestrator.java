package com.phillippitts.captionhub.service.session;

import com.phillippitts.captionhub.domain.Session;
import com.phillippitts.captionhub.domain.TranscriptSegment;

import java.util.List;

/**
 * Owns the lifecycle of caption sessions and wires their segments into the pipeline.
 *
 * <p><b>Session Lifecycle:</b>
 * <pre>
 * CREATED → ACTIVE (via startSession)
 * ACTIVE → ENDED (via endSession or stopSession)
 * </pre>
 * Any other transition throws
 * {@link com.phillippitts.captionhub.exception.InvalidStateTransitionException} and leaves the
 * session untouched.
 *
 * <p><b>Thread Safety:</b> implementations must be safe for concurrent control calls, segment
 * submissions and reads.
 */
public interface SessionOrchestrator {

    /**
     * Registers a new session in {@code CREATED}.
     *
     * @param sourceLanguage  language code of the transcript
     * @param targetLanguages language codes to translate into; non-empty, without the source
     * @param loggingEnabled  whether released translations are persisted
     * @throws com.phillippitts.captionhub.exception.UnsupportedLanguageException for unknown
     *         or inconsistent language codes
     */
    Session createSession(String sourceLanguage, List<String> targetLanguages, boolean loggingEnabled);

    /**
     * Activates the session and opens one channel per target language.
     *
     * @throws com.phillippitts.captionhub.exception.SessionStartException when a channel cannot be opened
     */
    Session startSession(String sessionId);

    /**
     * Ends the session: stops accepting segments, lets in-flight translations finish within
     * the grace period, tears down channels and subscribers, then drains persistence.
     */
    Session endSession(String sessionId);

    /**
     * Same as {@link #endSession(String)}.
     */
    Session stopSession(String sessionId);

    /**
     * @throws com.phillippitts.captionhub.exception.SessionNotFoundException when the id is
     *         neither live nor recently ended
     */
    Session getSession(String sessionId);

    List<Session> activeSessions();

    /**
     * Hands a final segment to the translation fan-out.
     *
     * @return {@code false} when the session is not {@code ACTIVE}; the segment is dropped
     * @throws com.phillippitts.captionhub.exception.SessionNotFoundException for unknown sessions
     */
    boolean submitSegment(TranscriptSegment segment);
}
