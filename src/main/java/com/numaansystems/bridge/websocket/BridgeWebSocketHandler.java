package com.numaansystems.bridge.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.bridge.config.BridgeProperties;
import com.numaansystems.bridge.registry.BridgeMessage;
import com.numaansystems.bridge.registry.ConnectionRegistry;
import com.numaansystems.bridge.registry.DeliveryResult;
import com.numaansystems.bridge.registry.RegisterResult;
import com.numaansystems.bridge.service.AuthorizeUrlBuilder;
import com.numaansystems.bridge.util.CorrelationIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.security.Principal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accepts launcher connections waiting for a login result.
 *
 * <h2>Connection Lifecycle</h2>
 * <ol>
 *   <li>Connect: a fresh correlation id is registered for the session</li>
 *   <li>The client receives {@code {"id":"...","url":"..."}} and opens the URL in a browser</li>
 *   <li>The callback delivers one result message, then the server closes the socket</li>
 *   <li>Close before a result: the session is unregistered and the result will be dropped</li>
 * </ol>
 *
 * <p>Messages sent by the client are ignored.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class BridgeWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(BridgeWebSocketHandler.class);

    static final String SESSION_ID_ATTRIBUTE = "bridge.sessionId";
    static final String CHANNEL_ATTRIBUTE = "bridge.channel";

    private final ConnectionRegistry registry;
    private final AuthorizeUrlBuilder urlBuilder;
    private final ObjectMapper objectMapper;
    private final BridgeProperties.Websocket limits;

    public BridgeWebSocketHandler(ConnectionRegistry registry, AuthorizeUrlBuilder urlBuilder,
                                  ObjectMapper objectMapper, BridgeProperties properties) {
        this.registry = registry;
        this.urlBuilder = urlBuilder;
        this.objectMapper = objectMapper;
        this.limits = properties.websocket();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String id = CorrelationIds.generate();
        WebSocketOutboundChannel channel = new WebSocketOutboundChannel(new ConcurrentWebSocketSessionDecorator(
                session, (int) limits.sendTimeLimit().toMillis(), limits.bufferSizeLimit()));

        Principal principal = session.getPrincipal();
        String owner = principal != null ? principal.getName() : null;

        // a close racing with registration must find the id on the session
        session.getAttributes().put(SESSION_ID_ATTRIBUTE, id);
        session.getAttributes().put(CHANNEL_ATTRIBUTE, channel);

        if (registry.register(id, channel, owner) == RegisterResult.ALREADY_REGISTERED) {
            logger.error("Generated session id collided with a live session, closing connection {}", session.getId());
            session.getAttributes().remove(SESSION_ID_ATTRIBUTE);
            session.getAttributes().remove(CHANNEL_ATTRIBUTE);
            session.close(CloseStatus.SERVER_ERROR);
            return;
        }
        if (!session.isOpen()) {
            registry.unregister(id, channel);
            logger.info("Client left while session {} was being registered", id);
            return;
        }

        Map<String, String> hello = new LinkedHashMap<>();
        hello.put("id", id);
        hello.put("url", urlBuilder.buildAuthorizeUrl(id));

        if (registry.deliver(id, BridgeMessage.text(objectMapper.writeValueAsString(hello))) == DeliveryResult.NOT_FOUND) {
            logger.info("Client left before session {} was announced", id);
            return;
        }
        logger.info("Session {} opened for {}", id, owner != null ? owner : "anonymous client");
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        logger.debug("Ignoring {} byte message from session {}", message.getPayloadLength(),
                session.getAttributes().get(SESSION_ID_ATTRIBUTE));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.debug("Transport error on session {}: {}", session.getAttributes().get(SESSION_ID_ATTRIBUTE),
                exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String id = (String) session.getAttributes().get(SESSION_ID_ATTRIBUTE);
        WebSocketOutboundChannel channel = (WebSocketOutboundChannel) session.getAttributes().get(CHANNEL_ATTRIBUTE);
        if (id == null || channel == null) {
            return;
        }
        if (registry.unregister(id, channel)) {
            logger.info("Session {} closed by client before a result ({})", id, status.getCode());
        }
    }
}
