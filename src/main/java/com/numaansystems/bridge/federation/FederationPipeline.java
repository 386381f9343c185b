package com.numaansystems.bridge.federation;

import com.numaansystems.bridge.federation.model.AccountProfile;
import com.numaansystems.bridge.federation.model.FederatedUserToken;
import com.numaansystems.bridge.federation.model.ProviderTokens;
import com.numaansystems.bridge.federation.model.SecurityToken;
import com.numaansystems.bridge.federation.model.ServiceAccessToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Turns an authorization code into an {@link AccountProfile} by running the
 * federation stages strictly in order.
 *
 * <p>The first failing stage stops the pipeline and is reported as a
 * {@link PipelineException} carrying the stage and its cause, including
 * unexpected runtime failures inside a stage. Nothing is
 * retried or cached, and intermediate tokens never leave this method.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class FederationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(FederationPipeline.class);

    private final FederationClient federationClient;

    public FederationPipeline(FederationClient federationClient) {
        this.federationClient = federationClient;
    }

    /**
     * Runs stages A to E for an authorization code.
     *
     * @param authorizationCode code from the provider redirect
     * @return the account profile
     * @throws PipelineException identifying the stage that failed
     */
    public AccountProfile run(String authorizationCode) throws PipelineException {
        long started = System.nanoTime();

        ProviderTokens tokens = runStage(FederationStage.CODE_EXCHANGE,
                () -> federationClient.exchangeCode(authorizationCode));
        FederatedUserToken userToken = runStage(FederationStage.FEDERATED_TOKEN,
                () -> federationClient.fetchFederatedUserToken(tokens));
        SecurityToken securityToken = runStage(FederationStage.SECURITY_TOKEN,
                () -> federationClient.fetchSecurityToken(userToken));
        ServiceAccessToken accessToken = runStage(FederationStage.SERVICE_TOKEN,
                () -> federationClient.fetchServiceAccessToken(securityToken));
        AccountProfile profile = runStage(FederationStage.PROFILE,
                () -> federationClient.fetchProfile(accessToken));

        logger.info("Federation completed for account {} in {} ms", profile.getId(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return profile;
    }

    private <T> T runStage(FederationStage stage, StageCall<T> call) throws PipelineException {
        long started = System.nanoTime();
        try {
            T result = call.execute();
            if (result == null) {
                throw new PipelineException(stage,
                        new FederationSerializationException("Stage " + stage.getStageName() + " returned no result"));
            }
            logger.debug("Stage {} completed in {} ms", stage.getStageName(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            return result;
        } catch (FederationException e) {
            logger.warn("Stage {} failed with {}: {}", stage.getStageName(), e.getErrorCode(), e.getMessage());
            throw new PipelineException(stage, e);
        } catch (RuntimeException e) {
            // keeps the failure attributed to its stage
            logger.error("Stage {} failed unexpectedly: {}", stage.getStageName(), e.getMessage(), e);
            throw new PipelineException(stage, new FederationSerializationException(
                    "The " + stage.getStageName() + " response could not be processed.", e));
        }
    }

    @FunctionalInterface
    private interface StageCall<T> {
        T execute() throws FederationException;
    }
}
