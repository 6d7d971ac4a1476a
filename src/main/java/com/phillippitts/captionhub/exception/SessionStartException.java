package com.phillippitts.captionhub.exception;

/**
 * Thrown when a session cannot be started because one of its channels failed to open.
 * The session stays in its previous state and any channels already opened are closed.
 */
public class SessionStartException extends CaptionHubException {

    private final String sessionId;

    public SessionStartException(String sessionId, Throwable cause) {
        super("Failed to start session " + sessionId + ": " + cause.getMessage(), cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
