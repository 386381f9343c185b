package com.numaansystems.bridge.support;

import com.numaansystems.bridge.config.BridgeProperties;

import java.time.Duration;
import java.util.List;

/**
 * Bridge configuration for unit tests, defaults everywhere except credentials.
 */
public final class TestBridgeProperties {

    private TestBridgeProperties() {
    }

    public static BridgeProperties create() {
        return withTtl(null);
    }

    public static BridgeProperties withTtl(Duration sessionTtl) {
        return new BridgeProperties(
                "https://bridge.example.com",
                sessionTtl,
                Duration.ofMillis(50),
                List.of("*"),
                new BridgeProperties.Provider("client-id", "client-secret", null, null, null, null),
                null,
                null,
                null);
    }
}
