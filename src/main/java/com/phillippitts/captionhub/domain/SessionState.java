package com.phillippitts.captionhub.domain;

/**
 * Lifecycle states of a caption session.
 *
 * <pre>
 * CREATED → ACTIVE (startSession)
 * ACTIVE  → ENDED  (endSession)
 * </pre>
 */
public enum SessionState {
    CREATED,
    ACTIVE,
    ENDED
}
