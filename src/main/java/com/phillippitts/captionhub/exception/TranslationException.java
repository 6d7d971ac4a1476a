package com.phillippitts.captionhub.exception;

/**
 * Thrown by a translation client when a single translation request fails.
 *
 * <p>The {@link FailureKind} decides whether the fan-out retries the request:
 * timeouts, rate limits, server errors, network errors and a saturated translation pool are
 * transient; everything else fails the (segment, language) pair immediately.
 */
public class TranslationException extends CaptionHubException {

    public enum FailureKind {
        TIMEOUT(true),
        RATE_LIMITED(true),
        SERVER_ERROR(true),
        NETWORK(true),
        OVERLOADED(true),
        INVALID_INPUT(false),
        UNSUPPORTED_LANGUAGE(false),
        UNKNOWN(false);

        private final boolean transientFailure;

        FailureKind(boolean transientFailure) {
            this.transientFailure = transientFailure;
        }

        public boolean isTransient() {
            return transientFailure;
        }
    }

    private final FailureKind kind;
    private final String language;

    public TranslationException(String message, FailureKind kind, String language) {
        super(message + " (kind=" + kind + ", language=" + language + ")");
        this.kind = kind;
        this.language = language;
    }

    public TranslationException(String message, FailureKind kind, String language, Throwable cause) {
        super(message + " (kind=" + kind + ", language=" + language + ")", cause);
        this.kind = kind;
        this.language = language;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getLanguage() {
        return language;
    }

    public boolean isTransient() {
        return kind.isTransient();
    }
}
