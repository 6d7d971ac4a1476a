package com.phillippitts.captionhub.presentation.websocket;

import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.Language;
import com.phillippitts.captionhub.exception.ChannelNotFoundException;
import com.phillippitts.captionhub.service.broadcast.BroadcastHub;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * Subscriber endpoint: {@code /ws/captions?sessionId=…&language=…[&lastSequence=n]}.
 *
 * <p>On connect the subscriber is registered with the broadcast hub, which replays the
 * channel backlog (after {@code lastSequence} when given) and then streams live captions.
 * Unknown channels and malformed parameters close the socket with a policy-violation status.
 * Inbound client messages are ignored.
 */
@Component
public class CaptionWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(CaptionWebSocketHandler.class);

    private final BroadcastHub hub;

    public CaptionWebSocketHandler(BroadcastHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        MultiValueMap<String, String> params = queryParams(session.getUri());
        String sessionId = params.getFirst("sessionId");
        String language = params.getFirst("language");
        if (sessionId == null || sessionId.isBlank() || language == null || language.isBlank()) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason("sessionId and language are required"));
            return;
        }
        Long lastSequence;
        try {
            String raw = params.getFirst("lastSequence");
            lastSequence = raw == null || raw.isBlank() ? null : Long.valueOf(raw);
        } catch (NumberFormatException e) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason("lastSequence must be a number"));
            return;
        }
        String code = Language.find(language).map(Language::code).orElse(language);
        ChannelKey key = new ChannelKey(sessionId, code);
        ThreadContext.put("sessionId", sessionId);
        ThreadContext.put("language", code);
        try {
            hub.subscribe(key, new WebSocketSubscriberConnection(session), lastSequence);
        } catch (ChannelNotFoundException e) {
            LOG.info("Websocket {} asked for unknown channel {}", session.getId(), key);
            session.close(CloseStatus.POLICY_VIOLATION.withReason("unknown channel"));
        } finally {
            ThreadContext.remove("sessionId");
            ThreadContext.remove("language");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        LOG.debug("Websocket {} closed: {}", session.getId(), status);
        hub.unsubscribe(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.info("Websocket {} transport error: {}", session.getId(), exception.getMessage());
        hub.unsubscribe(session.getId());
    }

    static MultiValueMap<String, String> queryParams(URI uri) {
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams();
    }
}
