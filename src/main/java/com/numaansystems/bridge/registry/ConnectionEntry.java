package com.numaansystems.bridge.registry;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live client connection waiting for its login result. Owned by the {@link ConnectionRegistry}.
 */
final class ConnectionEntry {

    private final String id;
    private final OutboundChannel sender;
    private final Instant createdAt;
    private final String owner;
    private final AtomicBoolean claimed = new AtomicBoolean(false);

    ConnectionEntry(String id, OutboundChannel sender, Instant createdAt, String owner) {
        this.id = id;
        this.sender = sender;
        this.createdAt = createdAt;
        this.owner = owner;
    }

    String getId() {
        return id;
    }

    OutboundChannel getSender() {
        return sender;
    }

    Instant getCreatedAt() {
        return createdAt;
    }

    String getOwner() {
        return owner;
    }

    /**
     * @return true for the first caller only
     */
    boolean tryClaim() {
        return claimed.compareAndSet(false, true);
    }
}
