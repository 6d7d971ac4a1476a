package com.phillippitts.captionhub.service.translation;

import com.phillippitts.captionhub.exception.TranslationException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic stand-in translator for local runs and tests: tags the source text with
 * the target language ({@code "[fr] bonjour"}).
 */
@Component
@ConditionalOnProperty(prefix = "translation", name = "provider", havingValue = "echo", matchIfMissing = true)
public class EchoTranslationClient implements TranslationClient {

    @Override
    public String translate(TranslationRequest request) {
        if (request.text().isBlank()) {
            throw new TranslationException("Nothing to translate",
                    TranslationException.FailureKind.INVALID_INPUT, request.targetLanguage());
        }
        return "[" + request.targetLanguage() + "] " + request.text();
    }

    @Override
    public String name() {
        return "echo";
    }
}
