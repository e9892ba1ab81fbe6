package com.example.presence.realtime.auth;

import com.example.presence.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Accepts a token equal to the URL-safe Base64 HMAC-SHA256 of the user id under the configured secret.
 */
@Slf4j
public class HmacCredentialValidator implements CredentialValidator {

    private static final String ALGORITHM = "HmacSHA256";

    private final AppProperties.Auth auth;

    public HmacCredentialValidator(AppProperties.Auth auth) {
        this.auth = auth;
    }

    @Override
    public boolean isValid(String userId, String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        if (!auth.isEnabled()) {
            return true;
        }
        if (auth.getTokenSecret() == null || auth.getTokenSecret().isEmpty()) {
            log.error("presence.auth.token-secret is not configured; rejecting handshake for user {}", userId);
            return false;
        }
        byte[] expected = sign(userId, auth.getTokenSecret()).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, token.getBytes(StandardCharsets.US_ASCII));
    }

    public static String sign(String userId, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(userId.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
