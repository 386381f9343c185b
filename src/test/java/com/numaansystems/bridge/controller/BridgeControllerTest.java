package com.numaansystems.bridge.controller;

import com.numaansystems.bridge.registry.ConnectionRegistry;
import com.numaansystems.bridge.service.AuthorizeUrlBuilder;
import com.numaansystems.bridge.service.CallbackOutcome;
import com.numaansystems.bridge.service.InvalidCorrelationIdException;
import com.numaansystems.bridge.service.LoginCallbackService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for BridgeController.
 *
 * <p>Tests the authorize redirect, the provider callback, health and the HTML
 * error pages.</p>
 */
@WebMvcTest(BridgeController.class)
@Import({TestSecurityConfig.class, BridgePages.class})
class BridgeControllerTest {

    private static final String AUTHORIZE_URL =
            "https://login.live.com/oauth20_authorize.srf?client_id=test&state=abc123";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuthorizeUrlBuilder urlBuilder;

    @MockBean
    private LoginCallbackService callbackService;

    @MockBean
    private ConnectionRegistry registry;

    @Test
    @DisplayName("Should redirect to the identity provider")
    void testInit() throws Exception {
        // Arrange
        when(urlBuilder.buildAuthorizeUrl("abc123")).thenReturn(AUTHORIZE_URL);

        // Act & Assert
        mockMvc.perform(get("/bridge/init").param("id", "abc123"))
                .andExpect(status().isTemporaryRedirect())
                .andExpect(header().string("Location", AUTHORIZE_URL))
                .andExpect(jsonPath("$.url").value(AUTHORIZE_URL));
    }

    @Test
    @DisplayName("Should show an error page for a malformed id")
    void testInitInvalidId() throws Exception {
        // Arrange
        when(urlBuilder.buildAuthorizeUrl(any())).thenThrow(new InvalidCorrelationIdException("bad id"));

        // Act & Assert
        mockMvc.perform(get("/bridge/init").param("id", "bad id"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
                .andExpect(content().string(containsString("Invalid sign-in link")));
    }

    @Test
    @DisplayName("Should hand the callback to the orchestrator and show the confirmation page")
    void testCallback() throws Exception {
        // Arrange
        when(callbackService.handleCallback("the-code", "abc123", null)).thenReturn(CallbackOutcome.SUCCESS_DELIVERED);

        // Act & Assert
        mockMvc.perform(get("/bridge/callback").param("code", "the-code").param("state", "abc123"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
                .andExpect(content().string(containsString("Sign-in received")))
                .andExpect(content().string(not(containsString("the-code"))));

        verify(callbackService).handleCallback("the-code", "abc123", null);
    }

    @Test
    @DisplayName("Should show the same confirmation page when the login failed")
    void testCallbackFailureLooksTheSame() throws Exception {
        // Arrange
        when(callbackService.handleCallback(isNull(), any(), any())).thenReturn(CallbackOutcome.FAILURE_DELIVERED);

        // Act & Assert
        mockMvc.perform(get("/bridge/callback")
                        .param("state", "abc123")
                        .param("error", "access_denied")
                        .param("error_description", "The user has denied access"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("Sign-in received")));

        verify(callbackService).handleCallback(null, "abc123", "access_denied");
    }

    @Test
    @DisplayName("Should show an error page for a callback without state")
    void testCallbackWithoutState() throws Exception {
        // Arrange
        when(callbackService.handleCallback(any(), isNull(), any())).thenThrow(new InvalidCorrelationIdException(null));

        // Act & Assert
        mockMvc.perform(get("/bridge/callback").param("code", "the-code"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML));
    }

    @Test
    @DisplayName("Should show a generic error page for unexpected failures")
    void testCallbackUnexpectedError() throws Exception {
        // Arrange
        when(callbackService.handleCallback(any(), any(), any())).thenThrow(new IllegalStateException("secret detail"));

        // Act & Assert
        mockMvc.perform(get("/bridge/callback").param("code", "the-code").param("state", "abc123"))
                .andExpect(status().isInternalServerError())
                .andExpect(content().string(containsString("Something went wrong")))
                .andExpect(content().string(not(containsString("secret detail"))));
    }

    @Test
    @DisplayName("Should return health status")
    void testHealth() throws Exception {
        // Arrange
        when(registry.size()).thenReturn(3);

        // Act & Assert
        mockMvc.perform(get("/bridge/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("federated-login-bridge"))
                .andExpect(jsonPath("$.activeSessions").value(3));
    }

    @Test
    @DisplayName("Should refuse a forged bearer token before reaching the controller")
    void testForgedBearerToken() throws Exception {
        // Act & Assert
        mockMvc.perform(get("/bridge/init").param("id", "abc123")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer forged"))
                .andExpect(status().isUnauthorized());
        verify(urlBuilder, never()).buildAuthorizeUrl(any());
    }
}
