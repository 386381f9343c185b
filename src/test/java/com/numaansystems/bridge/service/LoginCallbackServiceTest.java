package com.numaansystems.bridge.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.bridge.federation.FederationPipeline;
import com.numaansystems.bridge.federation.FederationStage;
import com.numaansystems.bridge.federation.PipelineException;
import com.numaansystems.bridge.federation.ProviderRejectedException;
import com.numaansystems.bridge.federation.model.AccountProfile;
import com.numaansystems.bridge.registry.ConnectionRegistry;
import com.numaansystems.bridge.support.RecordingChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for LoginCallbackService.
 *
 * <p>Runs callbacks against a real registry with a mocked pipeline and checks
 * what the waiting client receives.</p>
 */
@ExtendWith(MockitoExtension.class)
class LoginCallbackServiceTest {

    @Mock
    private FederationPipeline pipeline;

    @Mock
    private AccountLinkService accountLinkService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConnectionRegistry registry;
    private LoginCallbackService callbackService;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(Clock.systemUTC());
        callbackService = new LoginCallbackService(registry, pipeline, objectMapper);
    }

    @Test
    @DisplayName("Should deliver the profile to the waiting client and close it")
    void testSuccessfulLogin() throws Exception {
        // Arrange
        RecordingChannel channel = new RecordingChannel();
        registry.register("abc123", channel);
        when(pipeline.run("code")).thenReturn(new AccountProfile("uuid-1", "Steve"));

        // Act
        CallbackOutcome outcome = callbackService.handleCallback("code", "abc123", null);

        // Assert
        assertEquals(CallbackOutcome.SUCCESS_DELIVERED, outcome, "Outcome should be success");
        assertEquals(1, channel.getTextPayloads().size(), "Client should receive one payload");
        JsonNode payload = objectMapper.readTree(channel.getTextPayloads().get(0));
        assertEquals("uuid-1", payload.get("id").asText(), "Payload should carry the account id");
        assertEquals("Steve", payload.get("name").asText(), "Payload should carry the account name");
        assertTrue(channel.receivedClose(), "Client should be closed after the result");
        assertFalse(registry.contains("abc123"), "Session should be removed");
    }

    @Test
    @DisplayName("Should deliver a stage-attributed error when the account has no entitlement")
    void testEntitlementFailure() throws Exception {
        // Arrange
        RecordingChannel channel = new RecordingChannel();
        registry.register("abc123", channel);
        when(pipeline.run("code")).thenThrow(new PipelineException(FederationStage.PROFILE,
                new ProviderRejectedException("missing_entitlement", "No game license")));

        // Act
        CallbackOutcome outcome = callbackService.handleCallback("code", "abc123", null);

        // Assert
        assertEquals(CallbackOutcome.FAILURE_DELIVERED, outcome, "Outcome should be failure");
        JsonNode payload = objectMapper.readTree(channel.getTextPayloads().get(0));
        assertEquals("missing_entitlement", payload.get("error").asText(), "Error code should be delivered");
        assertEquals("profile", payload.get("stage").asText(), "Failed stage should be delivered");
        assertEquals("No game license", payload.get("message").asText(), "Message should be delivered");
        assertTrue(channel.receivedClose(), "Client should be closed after the error");
    }

    @Test
    @DisplayName("Should run the pipeline once for two concurrent callbacks")
    void testConcurrentDuplicateCallback() throws Exception {
        // Arrange
        RecordingChannel channel = new RecordingChannel();
        registry.register("abc123", channel);
        CountDownLatch pipelineEntered = new CountDownLatch(1);
        CountDownLatch releasePipeline = new CountDownLatch(1);
        when(pipeline.run(anyString())).thenAnswer(invocation -> {
            pipelineEntered.countDown();
            assertTrue(releasePipeline.await(5, TimeUnit.SECONDS));
            return new AccountProfile("uuid-1", "Steve");
        });

        // Act
        CompletableFuture<CallbackOutcome> first =
                CompletableFuture.supplyAsync(() -> callbackService.handleCallback("code", "abc123", null));
        assertTrue(pipelineEntered.await(5, TimeUnit.SECONDS), "First callback should reach the pipeline");
        CallbackOutcome second = callbackService.handleCallback("code", "abc123", null);
        releasePipeline.countDown();

        // Assert
        assertEquals(CallbackOutcome.DUPLICATE, second, "Replayed callback should be ignored");
        assertEquals(CallbackOutcome.SUCCESS_DELIVERED, first.get(5, TimeUnit.SECONDS),
                "First callback should deliver");
        verify(pipeline, times(1)).run(anyString());
        assertEquals(1, channel.getTextPayloads().size(), "Client should receive exactly one payload");
    }

    @Test
    @DisplayName("Should still run the pipeline when no client is waiting")
    void testNoWaitingClient() throws Exception {
        // Arrange
        when(pipeline.run("code")).thenReturn(new AccountProfile("uuid-1", "Steve"));

        // Act
        CallbackOutcome outcome = callbackService.handleCallback("code", "gone123", null);

        // Assert
        assertEquals(CallbackOutcome.UNDELIVERED, outcome, "Result should be dropped");
        verify(pipeline, times(1)).run("code");
        assertEquals(0, registry.size(), "Nothing should be registered");
    }

    @Test
    @DisplayName("Should deliver the provider error without running the pipeline")
    void testProviderError() throws Exception {
        // Arrange
        RecordingChannel channel = new RecordingChannel();
        registry.register("abc123", channel);

        // Act
        CallbackOutcome outcome = callbackService.handleCallback(null, "abc123", "access_denied");

        // Assert
        assertEquals(CallbackOutcome.FAILURE_DELIVERED, outcome, "Outcome should be failure");
        JsonNode payload = objectMapper.readTree(channel.getTextPayloads().get(0));
        assertEquals("access_denied", payload.get("error").asText(), "Provider error should be delivered");
        assertTrue(payload.get("stage").isNull(), "No stage should be reported");
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("Should not echo an unexpected provider error value")
    void testUnexpectedProviderError() throws Exception {
        // Arrange
        RecordingChannel channel = new RecordingChannel();
        registry.register("abc123", channel);

        // Act
        callbackService.handleCallback(null, "abc123", "<script>alert(1)</script>");

        // Assert
        JsonNode payload = objectMapper.readTree(channel.getTextPayloads().get(0));
        assertEquals("authorization_failed", payload.get("error").asText(), "Unknown value should be replaced");
    }

    @Test
    @DisplayName("Should report a missing authorization code")
    void testMissingCode() throws Exception {
        // Arrange
        RecordingChannel channel = new RecordingChannel();
        registry.register("abc123", channel);

        // Act
        CallbackOutcome outcome = callbackService.handleCallback("", "abc123", null);

        // Assert
        assertEquals(CallbackOutcome.FAILURE_DELIVERED, outcome, "Outcome should be failure");
        JsonNode payload = objectMapper.readTree(channel.getTextPayloads().get(0));
        assertEquals("missing_code", payload.get("error").asText(), "Missing code should be reported");
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("Should reject a malformed state before touching the registry")
    void testInvalidState() {
        // Act & Assert
        assertThrows(InvalidCorrelationIdException.class,
                () -> callbackService.handleCallback("code", "not a valid id!", null));
        assertThrows(InvalidCorrelationIdException.class,
                () -> callbackService.handleCallback("code", null, null));
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("Should deliver an internal error when the pipeline fails unexpectedly")
    void testUnexpectedFailure() throws Exception {
        // Arrange
        RecordingChannel channel = new RecordingChannel();
        registry.register("abc123", channel);
        when(pipeline.run("code")).thenThrow(new IllegalStateException("boom"));

        // Act
        CallbackOutcome outcome = callbackService.handleCallback("code", "abc123", null);

        // Assert
        assertEquals(CallbackOutcome.FAILURE_DELIVERED, outcome, "Client should still get a result");
        JsonNode payload = objectMapper.readTree(channel.getTextPayloads().get(0));
        assertEquals("internal_error", payload.get("error").asText(), "Error should be generic");
        assertFalse(payload.get("message").asText().contains("boom"), "Internal detail should not leak");
    }

    @Test
    @DisplayName("Should link the account even when the client is gone")
    void testAccountLinkCommittedWithoutDelivery() throws Exception {
        // Arrange
        ReflectionTestUtils.setField(callbackService, "accountLinkService", accountLinkService);
        RecordingChannel channel = new RecordingChannel();
        registry.register("abc123", channel, "steve@example.com");
        channel.disconnect();
        AccountProfile profile = new AccountProfile("uuid-1", "Steve");
        when(pipeline.run("code")).thenReturn(profile);

        // Act
        CallbackOutcome outcome = callbackService.handleCallback("code", "abc123", null);

        // Assert
        assertEquals(CallbackOutcome.UNDELIVERED, outcome, "Delivery should fail");
        verify(accountLinkService, times(1)).linkAccount("steve@example.com", profile);
    }

    @Test
    @DisplayName("Should report a failed account link instead of the profile")
    void testAccountLinkFailure() throws Exception {
        // Arrange
        ReflectionTestUtils.setField(callbackService, "accountLinkService", accountLinkService);
        RecordingChannel channel = new RecordingChannel();
        registry.register("abc123", channel, "steve@example.com");
        when(pipeline.run("code")).thenReturn(new AccountProfile("uuid-1", "Steve"));
        doThrow(new AccountLinkException("account_already_linked", "Already linked"))
                .when(accountLinkService).linkAccount(anyString(), any());

        // Act
        CallbackOutcome outcome = callbackService.handleCallback("code", "abc123", null);

        // Assert
        assertEquals(CallbackOutcome.FAILURE_DELIVERED, outcome, "Outcome should be failure");
        JsonNode payload = objectMapper.readTree(channel.getTextPayloads().get(0));
        assertEquals("account_already_linked", payload.get("error").asText(), "Link error should be delivered");
        assertTrue(payload.get("stage").isNull(), "Link failures have no stage");
    }

    @Test
    @DisplayName("Should skip linking for anonymous connections")
    void testAnonymousConnectionNotLinked() throws Exception {
        // Arrange
        ReflectionTestUtils.setField(callbackService, "accountLinkService", accountLinkService);
        registry.register("abc123", new RecordingChannel());
        when(pipeline.run("code")).thenReturn(new AccountProfile("uuid-1", "Steve"));

        // Act
        CallbackOutcome outcome = callbackService.handleCallback("code", "abc123", null);

        // Assert
        assertEquals(CallbackOutcome.SUCCESS_DELIVERED, outcome, "Outcome should be success");
        verify(accountLinkService, never()).linkAccount(anyString(), any());
    }
}
