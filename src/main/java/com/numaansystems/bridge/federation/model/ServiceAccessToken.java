package com.numaansystems.bridge.federation.model;

/**
 * Access token for the target service.
 */
public final class ServiceAccessToken {

    private final String token;
    private final long expiresIn;

    public ServiceAccessToken(String token, long expiresIn) {
        this.token = token;
        this.expiresIn = expiresIn;
    }

    public String getToken() {
        return token;
    }

    public long getExpiresIn() {
        return expiresIn;
    }

    @Override
    public String toString() {
        return "ServiceAccessToken[token=***, expiresIn=" + expiresIn + "]";
    }
}
