package com.phillippitts.captionhub.service.broadcast;

import java.util.Locale;

/**
 * Why a subscriber was removed from its channel.
 */
public enum DisconnectReason {
    /** The client closed the connection. */
    CLIENT_CLOSED,
    /** The outbound queue was full when a caption was released. */
    QUEUE_OVERFLOW,
    /** A single send exceeded the configured send timeout. */
    SEND_TIMEOUT,
    /** The transport reported an error while sending. */
    SEND_FAILED,
    /** The delivery pool refused to schedule the subscriber's drain. */
    DELIVERY_REJECTED,
    /** The channel was closed because its session ended. */
    SESSION_ENDED;

    /**
     * @return lowercase tag used for metrics and close frames
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
