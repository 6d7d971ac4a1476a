package com.phillippitts.captionhub.presentation.controller;

import com.phillippitts.captionhub.domain.Language;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lists the supported language catalogue.
 */
@RestController
class LanguageController {

    @GetMapping("/api/languages")
    List<Language> languages() {
        return List.copyOf(Language.all());
    }
}
