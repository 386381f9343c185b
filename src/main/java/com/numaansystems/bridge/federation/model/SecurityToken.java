package com.numaansystems.bridge.federation.model;

/**
 * Security-token-service token scoped to the target service.
 */
public final class SecurityToken {

    private final String token;
    private final String userHash;

    public SecurityToken(String token, String userHash) {
        this.token = token;
        this.userHash = userHash;
    }

    public String getToken() {
        return token;
    }

    public String getUserHash() {
        return userHash;
    }

    @Override
    public String toString() {
        return "SecurityToken[token=***, userHash=***]";
    }
}
