package com.ai.quizbot.auth;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Webhook subscription handshake and optional {@code X-Hub-Signature-256}
 * payload check.
 */
@Component
public class WebhookVerifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookVerifier.class);

    private static final String SUBSCRIBE = "subscribe";
    private static final String SIGNATURE_PREFIX = "sha256=";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    @Value("${whatsapp.verify-token:}")
    private String verifyToken;

    @Value("${whatsapp.app-secret:}")
    private String appSecret;

    /**
     * @return the challenge to echo back when mode and token match
     */
    public Optional<String> verifySubscription(String mode, String token, String challenge) {
        if (SUBSCRIBE.equals(mode) && StringUtils.isNotBlank(verifyToken) && verifyToken.equals(token)) {
            log.info("Webhook verified successfully");
            return Optional.of(challenge != null ? challenge : "");
        }
        log.warn("Webhook verification failed (mode={})", mode);
        return Optional.empty();
    }

    public boolean isSignatureCheckEnabled() {
        return StringUtils.isNotBlank(appSecret);
    }

    /** Always true when no app secret is configured. */
    public boolean verifySignature(String rawBody, String signatureHeader) {
        if (!isSignatureCheckEnabled()) {
            return true;
        }
        if (signatureHeader == null || !signatureHeader.startsWith(SIGNATURE_PREFIX)) {
            log.warn("Webhook delivery without a sha256 signature");
            return false;
        }
        byte[] expected = hmac(rawBody != null ? rawBody : "");
        byte[] given;
        try {
            given = HexFormat.of().parseHex(signatureHeader.substring(SIGNATURE_PREFIX.length()));
        } catch (IllegalArgumentException e) {
            log.warn("Malformed webhook signature header");
            return false;
        }
        boolean valid = MessageDigest.isEqual(expected, given);
        if (!valid) {
            log.warn("Webhook signature mismatch");
        }
        return valid;
    }

    private byte[] hmac(String body) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(appSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
