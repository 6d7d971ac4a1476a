package com.phillippitts.captionhub.service.translation;

import java.util.List;
import java.util.Objects;

/**
 * One request to translate a segment's text into a single target language.
 *
 * @param sessionId      owning session (diagnostics only)
 * @param sequence       segment sequence number (diagnostics only)
 * @param text           source text
 * @param sourceLanguage source language code
 * @param targetLanguage target language code
 * @param context        preceding source segments, oldest first; may be empty
 */
public record TranslationRequest(
        String sessionId,
        long sequence,
        String text,
        String sourceLanguage,
        String targetLanguage,
        List<String> context
) {

    public TranslationRequest {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
        context = context == null ? List.of() : List.copyOf(context);
    }
}
