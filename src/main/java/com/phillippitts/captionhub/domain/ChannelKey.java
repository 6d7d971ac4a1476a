package com.phillippitts.captionhub.domain;

import java.util.Objects;

/**
 * Identifies one ordered output stream: a target language within a session.
 */
public record ChannelKey(String sessionId, String language) {

    public ChannelKey {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(language, "language must not be null");
    }

    @Override
    public String toString() {
        return sessionId + "/" + language;
    }
}
