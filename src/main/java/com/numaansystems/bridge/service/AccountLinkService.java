package com.numaansystems.bridge.service;

import com.numaansystems.bridge.federation.model.AccountProfile;

/**
 * Optional service persisting the link between a local user and the federated account.
 *
 * <p>Called only after the federation pipeline succeeded, before the result is
 * delivered, so the link never depends on whether the client is still
 * connected. The bridge works without an implementation; enable
 * {@link JdbcAccountLinkService} with {@code bridge.account-link.enabled=true}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface AccountLinkService {

    /**
     * Links the account profile to a local user.
     * 
     * @param username the local user that opened the client connection
     * @param profile the federated account
     * @throws AccountLinkException if the link cannot be stored
     */
    void linkAccount(String username, AccountProfile profile);
}
