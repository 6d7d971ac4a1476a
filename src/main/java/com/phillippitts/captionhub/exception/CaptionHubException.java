package com.phillippitts.captionhub.exception;

/**
 * Base exception for all CaptionHub application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class CaptionHubException extends RuntimeException {

    public CaptionHubException(String message) {
        super(message);
    }

    public CaptionHubException(String message, Throwable cause) {
        super(message, cause);
    }

    public CaptionHubException(Throwable cause) {
        super(cause);
    }
}
