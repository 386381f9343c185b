package com.numaansystems.bridge.controller;

import com.numaansystems.bridge.registry.ConnectionRegistry;
import com.numaansystems.bridge.service.AuthorizeUrlBuilder;
import com.numaansystems.bridge.service.CallbackOutcome;
import com.numaansystems.bridge.service.LoginCallbackService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Browser-facing endpoints of the login bridge.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>Launcher opens {@code /bridge/ws} and receives its session id</li>
 *   <li>Browser opens {@code /bridge/init?id=...} and is redirected to the identity provider</li>
 *   <li>Identity provider redirects back to {@code /bridge/callback?code=...&state=...}</li>
 *   <li>The result is pushed to the launcher; the browser only gets a confirmation page</li>
 * </ol>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@RequestMapping("/bridge")
@Tag(name = "Bridge", description = "Federated login for launcher clients")
public class BridgeController {

    private static final Logger logger = LoggerFactory.getLogger(BridgeController.class);

    private final AuthorizeUrlBuilder urlBuilder;
    private final LoginCallbackService callbackService;
    private final ConnectionRegistry registry;
    private final BridgePages pages;

    public BridgeController(AuthorizeUrlBuilder urlBuilder, LoginCallbackService callbackService,
                            ConnectionRegistry registry, BridgePages pages) {
        this.urlBuilder = urlBuilder;
        this.callbackService = callbackService;
        this.registry = registry;
        this.pages = pages;
    }

    @Operation(summary = "Redirect to the identity provider for a session")
    @GetMapping("/init")
    public ResponseEntity<Map<String, String>> init(@RequestParam(required = false) String id) {
        String url = urlBuilder.buildAuthorizeUrl(id);
        logger.debug("Redirecting session {} to the identity provider", id);

        return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
                .location(URI.create(url))
                .body(Map.of("url", url));
    }

    @Operation(summary = "Identity provider redirect target")
    @GetMapping("/callback")
    public ResponseEntity<String> callback(@RequestParam(required = false) String code,
                                           @RequestParam(required = false) String state,
                                           @RequestParam(name = "error", required = false) String error,
                                           @RequestParam(name = "error_description", required = false)
                                           String errorDescription) {
        if (error != null) {
            logger.debug("Provider error description for session {}: {}", state, errorDescription);
        }

        CallbackOutcome outcome = callbackService.handleCallback(code, state, error);
        logger.debug("Callback for session {} finished as {}", state, outcome);

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .body(pages.confirmation());
    }

    @Operation(summary = "Liveness and waiting session count")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthInfo = new HashMap<>();
        healthInfo.put("status", "UP");
        healthInfo.put("service", "federated-login-bridge");
        healthInfo.put("activeSessions", registry.size());

        return ResponseEntity.ok(healthInfo);
    }
}
