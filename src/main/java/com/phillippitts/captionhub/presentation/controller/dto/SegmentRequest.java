package com.phillippitts.captionhub.presentation.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Body of {@code POST /api/sessions/{id}/segments}: one transcript event from the
 * speech-to-text source. Validation happens in the segment source adapter.
 */
public record SegmentRequest(
        Long sequence,
        String text,
        @JsonProperty("isFinal") Boolean isFinal,
        Instant timestamp
) {
}
