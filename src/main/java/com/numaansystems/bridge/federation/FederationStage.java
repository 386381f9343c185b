package com.numaansystems.bridge.federation;

/**
 * The stages of the federation pipeline, in execution order.
 */
public enum FederationStage {

    /** Authorization code to provider OAuth tokens. */
    CODE_EXCHANGE("code_exchange"),

    /** Provider access token to federated-identity user token. */
    FEDERATED_TOKEN("federated_token"),

    /** Federated user token to security-token-service token. */
    SECURITY_TOKEN("security_token"),

    /** Security token to the target service's access token. */
    SERVICE_TOKEN("service_token"),

    /** Service access token to account profile; fails without the entitlement. */
    PROFILE("profile");

    private final String stageName;

    FederationStage(String stageName) {
        this.stageName = stageName;
    }

    /**
     * @return the name reported to clients in error payloads
     */
    public String getStageName() {
        return stageName;
    }
}
