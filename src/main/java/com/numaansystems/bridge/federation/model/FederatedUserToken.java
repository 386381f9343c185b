package com.numaansystems.bridge.federation.model;

/**
 * Federated-identity user token together with the user hash it was issued for.
 */
public final class FederatedUserToken {

    private final String token;
    private final String userHash;

    public FederatedUserToken(String token, String userHash) {
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
        return "FederatedUserToken[token=***, userHash=***]";
    }
}
