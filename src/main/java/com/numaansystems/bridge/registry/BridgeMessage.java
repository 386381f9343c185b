package com.numaansystems.bridge.registry;

import java.util.Objects;

/**
 * A message pushed to a client connection: either a text payload or the close signal.
 */
public final class BridgeMessage {

    /** Message kinds a client connection can receive. */
    public enum Kind {
        TEXT,
        CLOSE
    }

    private static final BridgeMessage CLOSE = new BridgeMessage(Kind.CLOSE, null);

    private final Kind kind;
    private final String payload;

    private BridgeMessage(Kind kind, String payload) {
        this.kind = kind;
        this.payload = payload;
    }

    public static BridgeMessage text(String payload) {
        return new BridgeMessage(Kind.TEXT, Objects.requireNonNull(payload, "payload"));
    }

    public static BridgeMessage close() {
        return CLOSE;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the text payload, or null for {@link Kind#CLOSE}
     */
    public String getPayload() {
        return payload;
    }

    public boolean isClose() {
        return kind == Kind.CLOSE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BridgeMessage other)) {
            return false;
        }
        return kind == other.kind && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        return kind == Kind.CLOSE ? "BridgeMessage[CLOSE]" : "BridgeMessage[TEXT, " + payload.length() + " chars]";
    }
}
