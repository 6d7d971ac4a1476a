package com.phillippitts.captionhub.presentation.controller.dto;

import com.phillippitts.captionhub.domain.Session;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST representation of a session, including the number of accepted transcript segments and
 * live subscriber counts per target language.
 */
public record SessionView(
        String id,
        String sourceLanguage,
        List<String> targetLanguages,
        String state,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        boolean loggingEnabled,
        long transcriptCount,
        Map<String, Integer> subscribers
) {

    public static SessionView of(Session session, Map<String, Integer> subscribers) {
        return new SessionView(session.id(), session.sourceLanguage(), session.targetLanguages(),
                session.state().name(), session.createdAt(), session.startedAt(), session.endedAt(),
                session.loggingEnabled(), session.transcriptCount(), subscribers);
    }
}
