package com.phillippitts.captionhub.service.broadcast;

import java.io.IOException;

/**
 * Transport to one remote subscriber.
 *
 * <p>Implementations are called from a single delivery thread at a time for a given
 * subscriber; {@link #close(DisconnectReason)} may be called concurrently with a send and
 * should unblock it.
 */
public interface SubscriberConnection {

    /**
     * @return stable identifier of the connection, unique among live subscribers
     */
    String id();

    /**
     * Sends one frame, blocking until the transport accepted it.
     *
     * @throws IOException when the transport fails
     */
    void send(OutboundMessage message) throws IOException;

    /**
     * Closes the transport. Must be idempotent.
     */
    void close(DisconnectReason reason);

    boolean isOpen();
}
