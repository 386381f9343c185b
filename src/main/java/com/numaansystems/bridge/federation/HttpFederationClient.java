package com.numaansystems.bridge.federation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.numaansystems.bridge.config.BridgeProperties;
import com.numaansystems.bridge.federation.model.AccountProfile;
import com.numaansystems.bridge.federation.model.FederatedUserToken;
import com.numaansystems.bridge.federation.model.ProviderTokens;
import com.numaansystems.bridge.federation.model.SecurityToken;
import com.numaansystems.bridge.federation.model.ServiceAccessToken;
import jakarta.annotation.PreDestroy;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link FederationClient} talking to the real identity federation endpoints over HTTP.
 *
 * <h2>Stages</h2>
 * <ol>
 *   <li>OAuth token endpoint: form POST with the authorization code</li>
 *   <li>User authentication endpoint: RPS ticket for a federated user token and user hash</li>
 *   <li>Security token service: user token for a token scoped to the target service</li>
 *   <li>Target service login: {@code XBL3.0} token for the service's access token</li>
 *   <li>Profile endpoint: bearer access token for the account id and name</li>
 * </ol>
 *
 * <h2>Failure Classification</h2>
 * <ul>
 *   <li>I/O errors, timeouts, HTTP 5xx and 429 raise {@link ProviderTransportException}</li>
 *   <li>Other HTTP 4xx answers raise {@link ProviderRejectedException} with a stage-specific code</li>
 *   <li>Unparseable or incomplete bodies raise {@link FederationSerializationException}</li>
 * </ul>
 *
 * <p>Uses a shared HttpClient with bounded connect and response timeouts and
 * automatic retries disabled. Response bodies are never logged since they
 * carry tokens.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class HttpFederationClient implements FederationClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpFederationClient.class);

    private static final String USER_TOKEN_SITE_NAME = "user.auth.xboxlive.com";
    private static final String SANDBOX_ID = "RETAIL";
    private static final String LAUNCHER_PLATFORM = "PC_LAUNCHER";

    // XErr values returned by the security token service with HTTP 401
    private static final long XERR_NO_ACCOUNT = 2148916233L;
    private static final long XERR_REGION_UNAVAILABLE = 2148916235L;
    private static final long XERR_ADULT_VERIFICATION = 2148916236L;
    private static final long XERR_AGE_VERIFICATION = 2148916237L;
    private static final long XERR_CHILD_ACCOUNT = 2148916238L;

    private final BridgeProperties.Provider provider;
    private final BridgeProperties.Federation federation;
    private final String redirectUri;
    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;

    /**
     * Builds the shared HTTP client with the configured per-call timeouts.
     *
     * @param properties bridge configuration
     * @param objectMapper JSON mapper for request and response bodies
     */
    public HttpFederationClient(BridgeProperties properties, ObjectMapper objectMapper) {
        this.provider = properties.provider();
        this.federation = properties.federation();
        this.redirectUri = properties.callbackUrl();
        this.objectMapper = objectMapper;

        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.of(federation.connectTimeout()))
                .setSocketTimeout(Timeout.of(federation.responseTimeout()))
                .build();
        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.of(federation.responseTimeout()))
                .build();
        this.httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .disableCookieManagement()
                .build();
        logger.info("HttpFederationClient initialized with connect timeout {} and response timeout {}",
                federation.connectTimeout(), federation.responseTimeout());
    }

    /**
     * Closes the HTTP client when the bean is destroyed.
     */
    @PreDestroy
    public void destroy() {
        try {
            httpClient.close();
            logger.info("Federation HTTP client closed");
        } catch (IOException e) {
            logger.error("Error closing federation HTTP client", e);
        }
    }

    @Override
    public ProviderTokens exchangeCode(String authorizationCode) throws FederationException {
        HttpPost post = new HttpPost(provider.tokenUrl());
        post.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
        post.setEntity(new UrlEncodedFormEntity(List.of(
                new BasicNameValuePair("client_id", provider.clientId()),
                new BasicNameValuePair("client_secret", provider.clientSecret()),
                new BasicNameValuePair("code", authorizationCode),
                new BasicNameValuePair("grant_type", "authorization_code"),
                new BasicNameValuePair("redirect_uri", redirectUri)
        ), StandardCharsets.UTF_8));

        StageResponse response = send(post, "OAuth token endpoint");
        if (response.isRejected()) {
            // OAuth error responses carry the reason in "error", e.g. invalid_grant
            String error = optionalText(response.body, "error");
            throw new ProviderRejectedException(error != null ? error : "invalid_grant",
                    "The authorization code was rejected. It may have expired or already been used.");
        }

        JsonNode json = readJson(response.body, "OAuth token endpoint");
        return new ProviderTokens(
                requiredText(json, "/access_token", "OAuth token endpoint"),
                json.path("refresh_token").asText(null),
                json.path("expires_in").asLong(0));
    }

    @Override
    public FederatedUserToken fetchFederatedUserToken(ProviderTokens tokens) throws FederationException {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode properties = body.putObject("Properties");
        properties.put("AuthMethod", "RPS");
        properties.put("SiteName", USER_TOKEN_SITE_NAME);
        properties.put("RpsTicket", "d=" + tokens.getAccessToken());
        body.put("RelyingParty", federation.userTokenRelyingParty());
        body.put("TokenType", "JWT");

        StageResponse response = send(jsonPost(federation.userTokenUrl(), body), "user token endpoint");
        if (response.isRejected()) {
            throw new ProviderRejectedException("no_federated_identity",
                    "The account has no linked federated identity.");
        }

        JsonNode json = readJson(response.body, "user token endpoint");
        return new FederatedUserToken(
                requiredText(json, "/Token", "user token endpoint"),
                requiredText(json, "/DisplayClaims/xui/0/uhs", "user token endpoint"));
    }

    @Override
    public SecurityToken fetchSecurityToken(FederatedUserToken userToken) throws FederationException {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode properties = body.putObject("Properties");
        properties.put("SandboxId", SANDBOX_ID);
        properties.putArray("UserTokens").add(userToken.getToken());
        body.put("RelyingParty", federation.serviceRelyingParty());
        body.put("TokenType", "JWT");

        StageResponse response = send(jsonPost(federation.securityTokenUrl(), body), "security token service");
        if (response.isRejected()) {
            throw securityTokenRejection(response);
        }

        JsonNode json = readJson(response.body, "security token service");
        String userHash = json.at("/DisplayClaims/xui/0/uhs").asText(userToken.getUserHash());
        return new SecurityToken(requiredText(json, "/Token", "security token service"), userHash);
    }

    @Override
    public ServiceAccessToken fetchServiceAccessToken(SecurityToken securityToken) throws FederationException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("xtoken", "XBL3.0 x=" + securityToken.getUserHash() + ";" + securityToken.getToken());
        body.put("platform", LAUNCHER_PLATFORM);

        StageResponse response = send(jsonPost(federation.serviceTokenUrl(), body), "service login endpoint");
        if (response.isRejected()) {
            throw new ProviderRejectedException("service_token_denied",
                    "The target service did not accept the security token.");
        }

        JsonNode json = readJson(response.body, "service login endpoint");
        return new ServiceAccessToken(
                requiredText(json, "/access_token", "service login endpoint"),
                json.path("expires_in").asLong(0));
    }

    @Override
    public AccountProfile fetchProfile(ServiceAccessToken accessToken) throws FederationException {
        HttpGet get = new HttpGet(federation.profileUrl());
        get.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken.getToken());
        get.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());

        StageResponse response = send(get, "profile endpoint");
        if (response.status == 404) {
            throw new ProviderRejectedException("missing_entitlement",
                    "No profile found for this account. Make sure it owns the game and has chosen a profile name.");
        }
        if (response.isRejected()) {
            throw new ProviderRejectedException("profile_unavailable",
                    "The profile endpoint refused the access token.");
        }

        JsonNode json = readJson(response.body, "profile endpoint");
        return new AccountProfile(
                requiredText(json, "/id", "profile endpoint"),
                requiredText(json, "/name", "profile endpoint"));
    }

    private ProviderRejectedException securityTokenRejection(StageResponse response) {
        long xerr = response.status == 401 ? xerrOf(response.body) : 0;

        if (xerr == XERR_NO_ACCOUNT) {
            return new ProviderRejectedException("no_federated_account",
                    "The account has no profile on the federated network. Sign in there once to create one.");
        }
        if (xerr == XERR_REGION_UNAVAILABLE) {
            return new ProviderRejectedException("region_unavailable",
                    "The federated network is not available in the account's country.");
        }
        if (xerr == XERR_ADULT_VERIFICATION || xerr == XERR_AGE_VERIFICATION) {
            return new ProviderRejectedException("adult_verification_required",
                    "The account needs adult verification before it can sign in.");
        }
        if (xerr == XERR_CHILD_ACCOUNT) {
            return new ProviderRejectedException("child_account",
                    "Child accounts must be added to a family by an adult before they can sign in.");
        }
        return new ProviderRejectedException("security_token_denied",
                "The security token service refused the sign-in.");
    }

    private HttpPost jsonPost(String url, JsonNode body) throws FederationSerializationException {
        HttpPost post = new HttpPost(url);
        post.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
        try {
            post.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
        } catch (JsonProcessingException e) {
            throw new FederationSerializationException("Could not serialize request to " + url, e);
        }
        return post;
    }

    private StageResponse send(ClassicHttpRequest request, String endpoint) throws ProviderTransportException {
        StageResponse response;
        try {
            response = httpClient.execute(request, httpResponse -> new StageResponse(
                    httpResponse.getCode(),
                    httpResponse.getEntity() != null
                            ? EntityUtils.toString(httpResponse.getEntity(), StandardCharsets.UTF_8)
                            : ""));
        } catch (IOException e) {
            logger.warn("Request to {} failed: {}", endpoint, e.toString());
            throw new ProviderTransportException("Could not reach the " + endpoint + ".", e);
        }

        logger.debug("{} answered with HTTP {}", endpoint, response.status);
        if (response.status >= 500 || response.status == 429) {
            throw new ProviderTransportException(
                    "The " + endpoint + " is unavailable (HTTP " + response.status + ").");
        }
        return response;
    }

    private JsonNode readJson(String body, String endpoint) throws FederationSerializationException {
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json == null || !json.isObject()) {
                throw new FederationSerializationException("The " + endpoint + " returned no JSON object.");
            }
            return json;
        } catch (JsonProcessingException e) {
            throw new FederationSerializationException("The " + endpoint + " returned malformed JSON.", e);
        }
    }

    private String requiredText(JsonNode json, String pointer, String endpoint) throws FederationSerializationException {
        JsonNode node = json.at(pointer);
        if (!node.isTextual() || node.asText().isEmpty()) {
            throw new FederationSerializationException("The " + endpoint + " response is missing " + pointer + ".");
        }
        return node.asText();
    }

    /**
     * Reads the {@code XErr} code of a security token rejection, 0 when absent or not a valid code.
     */
    private long xerrOf(String body) {
        JsonNode xerr = errorField(body, "XErr");
        if (xerr == null) {
            return 0;
        }
        if (xerr.isNumber()) {
            return xerr.canConvertToLong() ? xerr.asLong() : 0;
        }
        try {
            return Long.parseLong(xerr.asText());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed XErr value");
            return 0;
        }
    }

    /**
     * Reads a top-level text field from an error body, or null when the body is not JSON.
     */
    private String optionalText(String body, String field) {
        JsonNode value = errorField(body, field);
        return value != null ? value.asText() : null;
    }

    private JsonNode errorField(String body, String field) {
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json == null || json.path(field).isMissingNode() || json.path(field).isNull()) {
                return null;
            }
            return json.path(field);
        } catch (JsonProcessingException e) {
            logger.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static final class StageResponse {
        private final int status;
        private final String body;

        private StageResponse(int status, String body) {
            this.status = status;
            this.body = body;
        }

        private boolean isRejected() {
            return status >= 400;
        }
    }
}
