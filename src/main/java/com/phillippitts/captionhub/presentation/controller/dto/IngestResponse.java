package com.phillippitts.captionhub.presentation.controller.dto;

/**
 * Outcome of one segment submission.
 */
public record IngestResponse(String sessionId, long sequence, String result) {
}
