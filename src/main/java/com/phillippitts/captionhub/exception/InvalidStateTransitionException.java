package com.phillippitts.captionhub.exception;

import com.phillippitts.captionhub.domain.SessionState;

/**
 * Thrown when a session lifecycle operation is invoked out of order
 * (e.g. starting an active session or ending an already-ended one).
 * The session is left untouched.
 */
public class InvalidStateTransitionException extends CaptionHubException {

    private final String sessionId;
    private final SessionState currentState;
    private final SessionState requestedState;

    public InvalidStateTransitionException(String sessionId, SessionState currentState,
                                           SessionState requestedState) {
        super("Session " + sessionId + " cannot move from " + currentState + " to " + requestedState);
        this.sessionId = sessionId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionState getCurrentState() {
        return currentState;
    }

    public SessionState getRequestedState() {
        return requestedState;
    }
}
