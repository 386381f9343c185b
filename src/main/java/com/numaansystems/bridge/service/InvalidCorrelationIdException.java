package com.numaansystems.bridge.service;

/**
 * A request carried a missing or malformed correlation id ({@code id} or {@code state}).
 */
public class InvalidCorrelationIdException extends RuntimeException {

    public InvalidCorrelationIdException(String id) {
        super(id == null || id.isEmpty()
                ? "No session id provided. Open a WebSocket at /bridge/ws to get one."
                : "Malformed session id.");
    }
}
