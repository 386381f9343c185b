package com.numaansystems.bridge.config;

import com.numaansystems.bridge.websocket.BridgeWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes the client endpoint at {@value #ENDPOINT}.
 *
 * <p>On connect the server sends {@code {"id":"...","url":"..."}}. Once the browser
 * finishes, exactly one result follows, either {@code {"id","name"}} or
 * {@code {"error","message","stage"}}, and the server closes the socket. A handshake
 * carrying a valid bearer token makes the token subject the owner of the session.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ENDPOINT = "/bridge/ws";

    private final BridgeWebSocketHandler handler;
    private final BridgeProperties properties;

    public WebSocketConfig(BridgeWebSocketHandler handler, BridgeProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, ENDPOINT)
                .setAllowedOriginPatterns(properties.allowedOrigins().toArray(new String[0]));
    }
}
