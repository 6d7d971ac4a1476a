package com.phillippitts.captionhub.config;

import com.phillippitts.captionhub.presentation.websocket.CaptionWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the caption subscriber endpoint.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final String CAPTIONS_PATH = "/ws/captions";

    private final CaptionWebSocketHandler captionHandler;

    public WebSocketConfig(CaptionWebSocketHandler captionHandler) {
        this.captionHandler = captionHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(captionHandler, CAPTIONS_PATH).setAllowedOriginPatterns("*");
    }
}
