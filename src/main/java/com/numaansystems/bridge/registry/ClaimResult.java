package com.numaansystems.bridge.registry;

import java.util.Optional;

/**
 * Outcome of {@link ConnectionRegistry#claim(String)}.
 */
public final class ClaimResult {

    public enum Status {
        /** This caller owns the login attempt. */
        CLAIMED,
        /** Another callback already claimed the id. */
        ALREADY_CLAIMED,
        /** No entry for the id. */
        NOT_FOUND
    }

    private static final ClaimResult ALREADY_CLAIMED = new ClaimResult(Status.ALREADY_CLAIMED, null);
    private static final ClaimResult NOT_FOUND = new ClaimResult(Status.NOT_FOUND, null);

    private final Status status;
    private final String owner;

    private ClaimResult(Status status, String owner) {
        this.status = status;
        this.owner = owner;
    }

    static ClaimResult claimed(String owner) {
        return new ClaimResult(Status.CLAIMED, owner);
    }

    static ClaimResult alreadyClaimed() {
        return ALREADY_CLAIMED;
    }

    static ClaimResult notFound() {
        return NOT_FOUND;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return the principal that opened the connection, when the handshake was authenticated
     */
    public Optional<String> getOwner() {
        return Optional.ofNullable(owner);
    }
}
