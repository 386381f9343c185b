package com.numaansystems.bridge.federation;

import com.numaansystems.bridge.federation.model.AccountProfile;
import com.numaansystems.bridge.federation.model.FederatedUserToken;
import com.numaansystems.bridge.federation.model.ProviderTokens;
import com.numaansystems.bridge.federation.model.SecurityToken;
import com.numaansystems.bridge.federation.model.ServiceAccessToken;

/**
 * One external request/response per federation stage.
 * 
 * <p>Each method is independent and stateless: it takes the previous stage's
 * output and produces the next one. Sequencing and short-circuiting belong to
 * {@link FederationPipeline}. Implementations do not retry.</p>
 * 
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface FederationClient {

    /**
     * Stage A: exchanges an authorization code for provider OAuth tokens.
     * 
     * @param authorizationCode code from the provider redirect
     * @return the provider tokens
     * @throws FederationException on invalid, expired or reused code, redirect-uri mismatch, or transport failure
     */
    ProviderTokens exchangeCode(String authorizationCode) throws FederationException;

    /**
     * Stage B: exchanges the provider access token for a federated user token.
     * 
     * @param tokens output of stage A
     * @return the user token and user hash
     * @throws FederationException if the account has no linked federated identity
     */
    FederatedUserToken fetchFederatedUserToken(ProviderTokens tokens) throws FederationException;

    /**
     * Stage C: exchanges the user token for a security token scoped to the target service.
     * 
     * @param userToken output of stage B
     * @return the security token
     * @throws FederationException on insufficient entitlement or service outage
     */
    SecurityToken fetchSecurityToken(FederatedUserToken userToken) throws FederationException;

    /**
     * Stage D: exchanges the security token for the target service's access token.
     * 
     * @param securityToken output of stage C
     * @return the service access token
     * @throws FederationException if the service refuses the token
     */
    ServiceAccessToken fetchServiceAccessToken(SecurityToken securityToken) throws FederationException;

    /**
     * Stage E: fetches the account profile.
     * 
     * @param accessToken output of stage D
     * @return the account profile
     * @throws FederationException with code {@code missing_entitlement} if the account does not own the product
     */
    AccountProfile fetchProfile(ServiceAccessToken accessToken) throws FederationException;
}
