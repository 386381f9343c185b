package com.numaansystems.bridge.federation.model;

/**
 * OAuth tokens issued by the identity provider for an authorization code.
 */
public final class ProviderTokens {

    private final String accessToken;
    private final String refreshToken;
    private final long expiresIn;

    public ProviderTokens(String accessToken, String refreshToken, long expiresIn) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresIn = expiresIn;
    }

    public String getAccessToken() {
        return accessToken;
    }

    /**
     * @return the refresh token, or null when the provider issued none
     */
    public String getRefreshToken() {
        return refreshToken;
    }

    /**
     * @return lifetime of the access token in seconds
     */
    public long getExpiresIn() {
        return expiresIn;
    }

    @Override
    public String toString() {
        return "ProviderTokens[accessToken=***, refreshToken=***, expiresIn=" + expiresIn + "]";
    }
}
