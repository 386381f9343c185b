package com.numaansystems.bridge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.bridge.federation.FederationPipeline;
import com.numaansystems.bridge.federation.PipelineException;
import com.numaansystems.bridge.federation.model.AccountProfile;
import com.numaansystems.bridge.registry.ClaimResult;
import com.numaansystems.bridge.registry.ConnectionRegistry;
import com.numaansystems.bridge.registry.DeliveryResult;
import com.numaansystems.bridge.util.CorrelationIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Handles the identity provider redirect for a pending login.
 *
 * <h2>Callback Flow</h2>
 * <ol>
 *   <li>Validate the {@code state} parameter as a correlation id</li>
 *   <li>Claim the session so a replayed callback cannot run the pipeline twice</li>
 *   <li>Run the federation pipeline with the authorization code</li>
 *   <li>Link the account to the connection owner if account linking is enabled</li>
 *   <li>Deliver exactly one terminal payload to the waiting client and close it</li>
 * </ol>
 *
 * <p>The browser never sees the account or the tokens. It only learns whether
 * the sign-in completed, so {@link CallbackOutcome} stays server side.</p>
 *
 * <h2>Payloads</h2>
 * <pre>
 * {"id":"...","name":"..."}
 * {"error":"missing_entitlement","message":"...","stage":"profile"}
 * </pre>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class LoginCallbackService {

    private static final Logger logger = LoggerFactory.getLogger(LoginCallbackService.class);

    private static final Pattern PROVIDER_ERROR_CODE = Pattern.compile("^[a-z_]{1,64}$");

    private final ConnectionRegistry registry;
    private final FederationPipeline pipeline;
    private final ObjectMapper objectMapper;

    @Autowired(required = false)
    private AccountLinkService accountLinkService;

    public LoginCallbackService(ConnectionRegistry registry, FederationPipeline pipeline, ObjectMapper objectMapper) {
        this.registry = registry;
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
    }

    /**
     * Completes the login attempt identified by {@code state}.
     *
     * @param code the authorization code, absent when the provider reports an error
     * @param state the correlation id sent with the authorize URL
     * @param providerError the provider's {@code error} parameter, or null
     * @return what happened to the result
     * @throws InvalidCorrelationIdException if {@code state} is missing or malformed
     */
    public CallbackOutcome handleCallback(String code, String state, String providerError) {
        String sessionId = CorrelationIds.requireValid(state);

        ClaimResult claim = registry.claim(sessionId);
        if (claim.getStatus() == ClaimResult.Status.ALREADY_CLAIMED) {
            logger.warn("Ignoring repeated callback for session {}", sessionId);
            return CallbackOutcome.DUPLICATE;
        }
        if (claim.getStatus() == ClaimResult.Status.NOT_FOUND) {
            // the pipeline still runs, the result is simply dropped
            logger.info("No client is waiting on session {}", sessionId);
        }

        boolean succeeded = false;
        String payload;
        if (providerError != null && !providerError.isBlank()) {
            logger.info("Provider reported {} for session {}", providerError, sessionId);
            payload = errorPayload(providerErrorCode(providerError),
                    "The sign-in was cancelled or refused by the identity provider.", null);
        } else if (code == null || code.isBlank()) {
            payload = errorPayload("missing_code", "The identity provider did not return an authorization code.", null);
        } else {
            try {
                AccountProfile profile = pipeline.run(code);
                linkAccount(claim, profile);
                payload = successPayload(profile);
                succeeded = true;
            } catch (PipelineException e) {
                payload = errorPayload(e.getErrorCode(), e.getStageMessage(), e.getStage().getStageName());
            } catch (AccountLinkException e) {
                payload = errorPayload(e.getErrorCode(), e.getMessage(), null);
            } catch (RuntimeException e) {
                logger.error("Unexpected error completing session {}: {}", sessionId, e.getMessage(), e);
                payload = errorPayload("internal_error", "The sign-in could not be completed.", null);
            }
        }

        DeliveryResult delivery = registry.deliverTerminal(sessionId, payload);
        if (delivery == DeliveryResult.NOT_FOUND) {
            logger.info("Result for session {} was dropped, the client is gone", sessionId);
            return CallbackOutcome.UNDELIVERED;
        }

        logger.info("Session {} completed {}", sessionId, succeeded ? "successfully" : "with an error");
        return succeeded ? CallbackOutcome.SUCCESS_DELIVERED : CallbackOutcome.FAILURE_DELIVERED;
    }

    private void linkAccount(ClaimResult claim, AccountProfile profile) {
        if (accountLinkService == null) {
            return;
        }
        claim.getOwner().ifPresent(owner -> accountLinkService.linkAccount(owner, profile));
    }

    private String successPayload(AccountProfile profile) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", profile.getId());
        body.put("name", profile.getName());
        return write(body);
    }

    private String errorPayload(String error, String message, String stage) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("stage", stage);
        return write(body);
    }

    private String write(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize result payload", e);
        }
    }

    private static String providerErrorCode(String providerError) {
        return PROVIDER_ERROR_CODE.matcher(providerError).matches() ? providerError : "authorization_failed";
    }
}
