package com.numaansystems.bridge.websocket;

import com.numaansystems.bridge.registry.BridgeMessage;
import com.numaansystems.bridge.registry.OutboundChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link OutboundChannel} over a WebSocket session.
 *
 * <p>The decorator bounds send time and buffered bytes, so a stalled client
 * makes {@link #offer} fail instead of blocking the callback thread.</p>
 */
public class WebSocketOutboundChannel implements OutboundChannel {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketOutboundChannel.class);

    private final ConcurrentWebSocketSessionDecorator session;

    public WebSocketOutboundChannel(ConcurrentWebSocketSessionDecorator session) {
        this.session = session;
    }

    @Override
    public boolean offer(BridgeMessage message) {
        if (!session.isOpen()) {
            return false;
        }
        try {
            if (message.isClose()) {
                session.close(CloseStatus.NORMAL);
            } else {
                session.sendMessage(new TextMessage(message.getPayload()));
            }
            return true;
        } catch (IOException | SessionLimitExceededException e) {
            logger.debug("Send to WebSocket {} failed: {}", session.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            logger.debug("Closing WebSocket {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
