package com.phillippitts.captionhub.presentation.websocket;

import com.phillippitts.captionhub.service.broadcast.CaptionMessageCodec;
import com.phillippitts.captionhub.service.broadcast.DisconnectReason;
import com.phillippitts.captionhub.service.broadcast.OutboundMessage;
import com.phillippitts.captionhub.service.broadcast.SubscriberConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link SubscriberConnection} backed by a Spring {@link WebSocketSession}; frames are sent
 * as JSON text messages.
 */
final class WebSocketSubscriberConnection implements SubscriberConnection {

    private static final Logger LOG = LogManager.getLogger(WebSocketSubscriberConnection.class);

    private final WebSocketSession session;

    WebSocketSubscriberConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(OutboundMessage message) throws IOException {
        session.sendMessage(new TextMessage(CaptionMessageCodec.encode(message)));
    }

    @Override
    public void close(DisconnectReason reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(closeStatus(reason));
        } catch (IOException e) {
            LOG.debug("Closing websocket {} failed: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    static CloseStatus closeStatus(DisconnectReason reason) {
        return switch (reason) {
            case SESSION_ENDED, CLIENT_CLOSED -> CloseStatus.NORMAL.withReason(reason.tag());
            case QUEUE_OVERFLOW, SEND_TIMEOUT, DELIVERY_REJECTED ->
                    CloseStatus.SESSION_NOT_RELIABLE.withReason(reason.tag());
            case SEND_FAILED -> CloseStatus.SERVER_ERROR.withReason(reason.tag());
        };
    }
}
