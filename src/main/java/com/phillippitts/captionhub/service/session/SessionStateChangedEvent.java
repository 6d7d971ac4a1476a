package com.phillippitts.captionhub.service.session;

import com.phillippitts.captionhub.domain.Session;

import java.time.Instant;

/**
 * Published after every session lifecycle transition.
 */
public record SessionStateChangedEvent(Session session, Instant at) {

    public SessionStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
