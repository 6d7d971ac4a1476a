package com.phillippitts.captionhub.exception;

/**
 * Thrown when a session id is neither active nor recently ended.
 */
public class SessionNotFoundException extends CaptionHubException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
