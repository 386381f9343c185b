package com.numaansystems.bridge.registry;

/**
 * Outcome of a delivery attempt against the {@link ConnectionRegistry}.
 */
public enum DeliveryResult {
    DELIVERED,
    /** No live connection for the id: never registered, already delivered, evicted or closed. */
    NOT_FOUND
}
