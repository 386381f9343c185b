package com.numaansystems.bridge.service;

import com.numaansystems.bridge.config.BridgeProperties;
import com.numaansystems.bridge.util.CorrelationIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Builds the identity provider's authorize URL for a pending login.
 *
 * <p>The correlation id travels as the OAuth {@code state} parameter and comes
 * back unchanged on the callback. No network call is made.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class AuthorizeUrlBuilder {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizeUrlBuilder.class);

    private final BridgeProperties.Provider provider;
    private final String redirectUri;

    /**
     * @param properties bridge configuration
     * @throws BridgeConfigurationException if the client id or public base URL is missing
     */
    public AuthorizeUrlBuilder(BridgeProperties properties) {
        if (properties.provider().clientId() == null || properties.provider().clientId().isBlank()) {
            throw new BridgeConfigurationException("bridge.provider.client-id is not configured");
        }
        if (properties.publicBaseUrl() == null || properties.publicBaseUrl().isBlank()) {
            throw new BridgeConfigurationException("bridge.public-base-url is not configured");
        }
        this.provider = properties.provider();
        this.redirectUri = properties.callbackUrl();
        logger.info("Authorize URLs will redirect back to {}", redirectUri);
    }

    /**
     * Builds the authorize URL for a correlation id.
     * 
     * @param correlationId id of the waiting client connection
     * @return the provider authorize URL with {@code state} set to the correlation id
     * @throws InvalidCorrelationIdException if the id is missing or malformed
     */
    public String buildAuthorizeUrl(String correlationId) {
        CorrelationIds.requireValid(correlationId);

        return UriComponentsBuilder.fromHttpUrl(provider.authorizeUrl())
                .queryParam("client_id", "{clientId}")
                .queryParam("response_type", "code")
                .queryParam("redirect_uri", "{redirectUri}")
                .queryParam("scope", "{scope}")
                .queryParam("state", "{state}")
                .queryParam("prompt", "{prompt}")
                .encode()
                .buildAndExpand(Map.of(
                        "clientId", provider.clientId(),
                        "redirectUri", redirectUri,
                        "scope", provider.scopes(),
                        "state", correlationId,
                        "prompt", provider.prompt()))
                .toUriString();
    }
}
