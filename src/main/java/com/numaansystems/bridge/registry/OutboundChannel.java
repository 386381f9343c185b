package com.numaansystems.bridge.registry;

/**
 * Sending half of a client connection, handed to the {@link ConnectionRegistry}.
 * 
 * <p>The receiving half stays with whoever owns the connection (the WebSocket
 * session in production). Implementations must never block the caller
 * indefinitely: a full or closed channel is reported by returning false.</p>
 */
public interface OutboundChannel {

    /**
     * Attempts to send a message without blocking indefinitely.
     * 
     * @param message the message; {@link BridgeMessage.Kind#CLOSE} closes the connection
     * @return true if the message was accepted, false if the channel is closed or full
     */
    boolean offer(BridgeMessage message);

    /**
     * Drops the channel, signalling the owning connection to close if it is still open.
     */
    void close();
}
