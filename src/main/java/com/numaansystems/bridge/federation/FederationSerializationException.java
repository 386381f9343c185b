package com.numaansystems.bridge.federation;

/**
 * A stage response could not be parsed or lacked a required field.
 */
public class FederationSerializationException extends FederationException {

    public static final String ERROR_CODE = "invalid_provider_response";

    public FederationSerializationException(String message) {
        super(ERROR_CODE, message);
    }

    public FederationSerializationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
