package com.numaansystems.bridge.service;

/**
 * Required bridge configuration is missing. Raised while the application starts, never per request.
 */
public class BridgeConfigurationException extends IllegalStateException {

    public BridgeConfigurationException(String message) {
        super(message);
    }
}
