package com.phillippitts.captionhub.service.translation;

import com.phillippitts.captionhub.domain.Translation;

/**
 * Receives the terminal translation for each (segment, language) pair.
 */
@FunctionalInterface
public interface TranslationSink {

    void onTranslation(Translation translation);
}
