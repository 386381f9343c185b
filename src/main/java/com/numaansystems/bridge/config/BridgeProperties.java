package com.numaansystems.bridge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Type-safe configuration for the login bridge, bound from the {@code bridge.*} prefix.
 *
 * <p>Missing client credentials or public address fail startup through Bean Validation.
 * Everything else has a default that matches the production identity chain:</p>
 *
 * <pre>
 * bridge:
 *   public-base-url: https://api.example.com
 *   session-ttl: PT30M
 *   sweep-interval: PT1M
 *   provider:
 *     client-id: ${MICROSOFT_CLIENT_ID}
 *     client-secret: ${MICROSOFT_CLIENT_SECRET}
 *   federation:
 *     response-timeout: PT10S
 *   account-link:
 *     enabled: true
 *     url: jdbc:mysql://localhost:3306/gateway_db
 *     username: bridge_user
 *     password: ${DB_PASSWORD}
 * </pre>
 *
 * @param publicBaseUrl address browsers use to reach this server, used for {@code redirect_uri}
 * @param sessionTtl how long an unclaimed WebSocket session may wait for its callback
 * @param sweepInterval how often expired sessions are evicted
 * @param allowedOrigins CORS and WebSocket origins
 * @param provider OAuth client registration at the identity provider
 * @param federation endpoints and timeouts of the token exchange chain
 * @param websocket outbound send limits per client connection
 * @param accountLink optional database the federated account is linked into
 */
@ConfigurationProperties(prefix = "bridge")
@Validated
public record BridgeProperties(
        @NotBlank String publicBaseUrl,
        Duration sessionTtl,
        Duration sweepInterval,
        List<String> allowedOrigins,
        @Valid Provider provider,
        @Valid Federation federation,
        @Valid Websocket websocket,
        AccountLink accountLink) {

    /** Path the identity provider redirects the browser back to. */
    public static final String CALLBACK_PATH = "/bridge/callback";

    public BridgeProperties {
        if (publicBaseUrl != null && publicBaseUrl.endsWith("/")) {
            publicBaseUrl = publicBaseUrl.substring(0, publicBaseUrl.length() - 1);
        }
        if (sessionTtl == null) {
            sessionTtl = Duration.ofMinutes(30);
        }
        if (sweepInterval == null) {
            sweepInterval = Duration.ofMinutes(1);
        }
        if (allowedOrigins == null) {
            allowedOrigins = List.of("*");
        }
        if (provider == null) {
            provider = new Provider(null, null, null, null, null, null);
        }
        if (federation == null) {
            federation = new Federation(null, null, null, null, null, null, null, null);
        }
        if (websocket == null) {
            websocket = new Websocket(null, 0);
        }
        if (accountLink == null) {
            accountLink = new AccountLink(false, null, null, null);
        }
    }

    /**
     * @return the {@code redirect_uri} registered with the identity provider
     */
    public String callbackUrl() {
        return publicBaseUrl + CALLBACK_PATH;
    }

    /**
     * OAuth client registration at the identity provider.
     */
    public record Provider(
            @NotBlank String clientId,
            @NotBlank String clientSecret,
            String authorizeUrl,
            String tokenUrl,
            String scopes,
            String prompt) {

        public Provider {
            if (authorizeUrl == null || authorizeUrl.isBlank()) {
                authorizeUrl = "https://login.live.com/oauth20_authorize.srf";
            }
            if (tokenUrl == null || tokenUrl.isBlank()) {
                tokenUrl = "https://login.live.com/oauth20_token.srf";
            }
            if (scopes == null || scopes.isBlank()) {
                scopes = "XboxLive.signin offline_access";
            }
            if (prompt == null || prompt.isBlank()) {
                prompt = "select_account";
            }
        }
    }

    /**
     * Endpoints of stages B to E and the per-call timeouts shared by all stages.
     */
    public record Federation(
            String userTokenUrl,
            String securityTokenUrl,
            String serviceTokenUrl,
            String profileUrl,
            String userTokenRelyingParty,
            String serviceRelyingParty,
            Duration connectTimeout,
            Duration responseTimeout) {

        public Federation {
            if (userTokenUrl == null || userTokenUrl.isBlank()) {
                userTokenUrl = "https://user.auth.xboxlive.com/user/authenticate";
            }
            if (securityTokenUrl == null || securityTokenUrl.isBlank()) {
                securityTokenUrl = "https://xsts.auth.xboxlive.com/xsts/authorize";
            }
            if (serviceTokenUrl == null || serviceTokenUrl.isBlank()) {
                serviceTokenUrl = "https://api.minecraftservices.com/launcher/login";
            }
            if (profileUrl == null || profileUrl.isBlank()) {
                profileUrl = "https://api.minecraftservices.com/minecraft/profile";
            }
            if (userTokenRelyingParty == null || userTokenRelyingParty.isBlank()) {
                userTokenRelyingParty = "http://auth.xboxlive.com";
            }
            if (serviceRelyingParty == null || serviceRelyingParty.isBlank()) {
                serviceRelyingParty = "rp://api.minecraftservices.com/";
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (responseTimeout == null) {
                responseTimeout = Duration.ofSeconds(10);
            }
        }
    }

    /**
     * Limits applied to every outbound WebSocket send so a slow client cannot stall a callback.
     */
    public record Websocket(Duration sendTimeLimit, int bufferSizeLimit) {

        public Websocket {
            if (sendTimeLimit == null) {
                sendTimeLimit = Duration.ofSeconds(5);
            }
            if (bufferSizeLimit <= 0) {
                bufferSizeLimit = 64 * 1024;
            }
        }
    }

    /**
     * Database holding the local {@code users} table. Only read when {@code enabled} is true.
     */
    public record AccountLink(boolean enabled, String url, String username, String password) {
    }
}
