package com.numaansystems.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.bridge.federation.FederationClient;
import com.numaansystems.bridge.federation.ProviderRejectedException;
import com.numaansystems.bridge.federation.model.AccountProfile;
import com.numaansystems.bridge.federation.model.FederatedUserToken;
import com.numaansystems.bridge.federation.model.ProviderTokens;
import com.numaansystems.bridge.federation.model.SecurityToken;
import com.numaansystems.bridge.federation.model.ServiceAccessToken;
import com.numaansystems.bridge.registry.ConnectionRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Integration tests for the bridge application.
 *
 * <p>Boots the full context on a random port, connects a real WebSocket client
 * and drives the provider callback over HTTP. Only the outbound federation
 * calls are mocked.</p>
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class BridgeApplicationTests {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ConnectionRegistry registry;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private FederationClient federationClient;

    @Test
    @DisplayName("Should report health")
    @SuppressWarnings("rawtypes")
    void testHealth() {
        ResponseEntity<Map> response = restTemplate.getForEntity("/bridge/health", Map.class);

        assertEquals(HttpStatus.OK, response.getStatusCode(), "Health should be reachable");
        assertEquals("UP", response.getBody().get("status"), "Status should be UP");
    }

    @Test
    @DisplayName("Should deliver the profile to the WebSocket client after the callback")
    void testEndToEndSuccess() throws Exception {
        // Arrange
        stubChainUpToProfile();
        when(federationClient.fetchProfile(any())).thenReturn(new AccountProfile("uuid-1", "Steve"));
        RecordingClient client = new RecordingClient();
        connect(client);
        String id = objectMapper.readTree(client.next()).get("id").asText();

        // Act
        ResponseEntity<String> page = restTemplate.getForEntity(
                "/bridge/callback?code=the-code&state={state}", String.class, id);

        // Assert
        assertEquals(HttpStatus.OK, page.getStatusCode(), "Browser should get the confirmation page");
        JsonNode result = objectMapper.readTree(client.next());
        assertEquals("uuid-1", result.get("id").asText(), "Client should receive the account id");
        assertEquals("Steve", result.get("name").asText(), "Client should receive the account name");
        assertEquals(CloseStatus.NORMAL.getCode(), client.awaitClose().getCode(), "Server should close the socket");
        assertFalse(registry.contains(id), "Session should be gone");
    }

    @Test
    @DisplayName("Should deliver a profile-stage error when the account has no entitlement")
    void testEndToEndEntitlementFailure() throws Exception {
        // Arrange
        stubChainUpToProfile();
        when(federationClient.fetchProfile(any()))
                .thenThrow(new ProviderRejectedException("missing_entitlement", "No game license"));
        RecordingClient client = new RecordingClient();
        connect(client);
        String id = objectMapper.readTree(client.next()).get("id").asText();

        // Act
        restTemplate.getForEntity("/bridge/callback?code=the-code&state={state}", String.class, id);

        // Assert
        JsonNode result = objectMapper.readTree(client.next());
        assertEquals("missing_entitlement", result.get("error").asText(), "Error code should be delivered");
        assertEquals("profile", result.get("stage").asText(), "Stage should be delivered");
        client.awaitClose();
    }

    @Test
    @DisplayName("Should show an error page for a malformed state")
    void testMalformedState() {
        ResponseEntity<String> page = restTemplate.getForEntity(
                "/bridge/callback?code=the-code&state={state}", String.class, "not valid!");

        assertEquals(HttpStatus.BAD_REQUEST, page.getStatusCode(), "Malformed state should be rejected");
    }

    private void stubChainUpToProfile() throws Exception {
        when(federationClient.exchangeCode("the-code")).thenReturn(new ProviderTokens("ms", "refresh", 3600));
        when(federationClient.fetchFederatedUserToken(any())).thenReturn(new FederatedUserToken("xbl", "uhs"));
        when(federationClient.fetchSecurityToken(any())).thenReturn(new SecurityToken("xsts", "uhs"));
        when(federationClient.fetchServiceAccessToken(any())).thenReturn(new ServiceAccessToken("mc", 86400));
    }

    private WebSocketSession connect(RecordingClient client) throws Exception {
        return new StandardWebSocketClient()
                .execute(client, "ws://localhost:" + port + "/bridge/ws")
                .get(5, TimeUnit.SECONDS);
    }

    private static class RecordingClient extends TextWebSocketHandler {

        private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final CompletableFuture<CloseStatus> closed = new CompletableFuture<>();

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            messages.add(message.getPayload());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closed.complete(status);
        }

        String next() throws InterruptedException {
            String message = messages.poll(5, TimeUnit.SECONDS);
            assertNotNull(message, "Expected a message from the bridge");
            return message;
        }

        CloseStatus awaitClose() throws Exception {
            return closed.get(5, TimeUnit.SECONDS);
        }
    }
}
