package com.phillippitts.captionhub.exception;

/**
 * Thrown when a transcript segment is malformed (missing session, bad sequence, blank text).
 * This is a non-transient failure and is never retried.
 */
public class InvalidSegmentException extends CaptionHubException {

    private final String reason;

    public InvalidSegmentException(String reason) {
        super("Invalid transcript segment: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
