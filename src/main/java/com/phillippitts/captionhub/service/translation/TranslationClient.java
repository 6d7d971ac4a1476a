package com.phillippitts.captionhub.service.translation;

import com.phillippitts.captionhub.exception.TranslationException;

/**
 * Port to the external language-model translation collaborator.
 *
 * <p>Implementations perform exactly one attempt per call; timeouts and retries are
 * enforced by {@link TranslationFanOut}. Implementations must be thread-safe.
 */
public interface TranslationClient {

    /**
     * Translates the request text into the request's target language.
     *
     * @param request text, languages and optional context
     * @return translated text, never {@code null}
     * @throws TranslationException classified failure; transient kinds are retried by the caller
     */
    String translate(TranslationRequest request);

    /**
     * Short provider name for logs.
     */
    String name();
}
