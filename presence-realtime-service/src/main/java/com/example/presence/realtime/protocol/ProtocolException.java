package com.example.presence.realtime.protocol;

import lombok.Getter;

import java.util.List;

/**
 * A client frame the server cannot act on. Answered with an {@code error} envelope;
 * the connection stays open.
 */
@Getter
public class ProtocolException extends RuntimeException {

    private final int status;
    private final String error;
    private final List<String> validActions;

    public ProtocolException(int status, String error, String message) {
        this(status, error, message, null);
    }

    public ProtocolException(int status, String error, String message, List<String> validActions) {
        super(message);
        this.status = status;
        this.error = error;
        this.validActions = validActions;
    }

    public static ProtocolException badRequest(String message) {
        return new ProtocolException(400, "Bad Request", message);
    }
}
