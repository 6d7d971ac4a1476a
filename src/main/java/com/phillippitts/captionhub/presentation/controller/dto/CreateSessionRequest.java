package com.phillippitts.captionhub.presentation.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Body of {@code POST /api/sessions}.
 *
 * @param loggingEnabled defaults to {@code true} when omitted
 */
public record CreateSessionRequest(
        @NotBlank String sourceLanguage,
        @NotEmpty List<String> targetLanguages,
        Boolean loggingEnabled
) {

    public boolean loggingEnabledOrDefault() {
        return loggingEnabled == null || loggingEnabled;
    }
}
