package com.phillippitts.captionhub.service.persistence;

import com.phillippitts.captionhub.domain.SessionState;

import java.time.Instant;
import java.util.Objects;

/**
 * Session lifecycle transition to store. Keyed by (sessionId, state).
 */
public record SessionEventRecord(String sessionId, SessionState state, Instant occurredAt)
        implements PersistenceRecord {

    public SessionEventRecord {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (occurredAt == null) {
            occurredAt = Instant.now();
        }
    }
}
