package com.example.presence.realtime.auth;

import lombok.Getter;

/**
 * Handshake rejected before anything was registered. Carries the WebSocket close code to answer with.
 */
@Getter
public class InvalidCredentialException extends RuntimeException {

    public static final int MISSING_USER = 4400;
    public static final int INVALID_TOKEN = 4401;

    private final int closeCode;

    public InvalidCredentialException(int closeCode, String message) {
        super(message);
        this.closeCode = closeCode;
    }
}
