package com.numaansystems.bridge.federation;

/**
 * Failure of a single federation stage.
 *
 * <p>Messages are shown to the end user through their client, so they must
 * never contain token material.</p>
 */
public abstract class FederationException extends Exception {

    private final String errorCode;

    protected FederationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected FederationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return machine-readable error code, e.g. {@code missing_entitlement}
     */
    public String getErrorCode() {
        return errorCode;
    }
}
