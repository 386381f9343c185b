package com.numaansystems.bridge.federation;

/**
 * The stage endpoint could not be reached, timed out, or answered with a server error.
 */
public class ProviderTransportException extends FederationException {

    public static final String ERROR_CODE = "provider_unavailable";

    public ProviderTransportException(String message) {
        super(ERROR_CODE, message);
    }

    public ProviderTransportException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
