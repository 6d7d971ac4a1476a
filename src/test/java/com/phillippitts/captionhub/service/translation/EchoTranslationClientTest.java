package com.phillippitts.captionhub.service.translation;

import com.phillippitts.captionhub.exception.TranslationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EchoTranslationClientTest {

    private final EchoTranslationClient client = new EchoTranslationClient();

    @Test
    void tagsTextWithTargetLanguage() {
        String out = client.translate(new TranslationRequest("s1", 1, "hello", "en", "fr", List.of()));

        assertThat(out).isEqualTo("[fr] hello");
    }

    @Test
    void blankTextIsNonTransientFailure() {
        assertThatThrownBy(() -> client.translate(new TranslationRequest("s1", 1, " ", "en", "fr", null)))
                .isInstanceOfSatisfying(TranslationException.class, e -> assertThat(e.isTransient()).isFalse());
    }
}
