package com.phillippitts.captionhub.exception;

/**
 * Thrown when a language code is not part of the supported catalogue
 * or a session's language configuration is inconsistent.
 */
public class UnsupportedLanguageException extends CaptionHubException {

    private final String languageCode;

    public UnsupportedLanguageException(String languageCode) {
        super("Unsupported language code: " + languageCode);
        this.languageCode = languageCode;
    }

    public UnsupportedLanguageException(String languageCode, String message) {
        super(message);
        this.languageCode = languageCode;
    }

    public String getLanguageCode() {
        return languageCode;
    }
}
