package com.ai.quizbot.controller;

import com.ai.quizbot.auth.WebhookVerifier;
import com.ai.quizbot.service.ConversationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final WebhookVerifier verifier;
    private final ConversationEngine engine;

    public WebhookController(WebhookVerifier verifier, ConversationEngine engine) {
        this.verifier = verifier;
        this.engine = engine;
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> home() {
        return ResponseEntity.ok("AEFI WhatsApp Bot is running!");
    }

    @GetMapping(value = "/webhook", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> verify(
            @RequestParam(value = "hub.mode", required = false) String mode,
            @RequestParam(value = "hub.verify_token", required = false) String token,
            @RequestParam(value = "hub.challenge", required = false) String challenge) {
        return verifier.verifySubscription(mode, token, challenge)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.FORBIDDEN).body("Verification failed"));
    }

    /**
     * Always acknowledges with 200 once the signature is accepted, even for
     * deliveries that are ignored or fail internally, so the provider does not
     * redeliver them.
     */
    @PostMapping(value = "/webhook", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody(required = false) String body,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature) {
        if (!verifier.verifySignature(body, signature)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("status", "forbidden"));
        }
        log.debug("Incoming webhook: {}", body);
        boolean routed;
        try {
            routed = engine.handle(body);
        } catch (RuntimeException e) {
            log.error("Error processing webhook", e);
            routed = false;
        }
        return ResponseEntity.ok(Map.of("status", routed ? "ok" : "ignored"));
    }
}
