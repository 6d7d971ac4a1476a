package com.phillippitts.captionhub.service.ingest;

import java.util.Locale;

/**
 * What the segment source adapter did with one incoming transcript event.
 */
public enum IngestResult {
    /** Final segment handed to the session pipeline. */
    ACCEPTED,
    /** Partial hypothesis; ignored. */
    DROPPED_PARTIAL,
    /** Missing session id, sequence below 1 or blank text. */
    REJECTED_INVALID,
    /** Sequence not greater than the last accepted one for the session. */
    REJECTED_OUT_OF_ORDER,
    /** Session exists but is not active. */
    REJECTED_SESSION_INACTIVE,
    /** Session id is unknown. */
    REJECTED_UNKNOWN_SESSION;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
