package com.example.presence.realtime.auth;

/**
 * Checks the credential presented on the WebSocket handshake.
 */
public interface CredentialValidator {

    /**
     * @return true if {@code token} proves the caller is {@code userId}
     */
    boolean isValid(String userId, String token);
}
