package com.example.presence.shared.exception;

import lombok.Getter;

/**
 * Raised by registry lookups for a connection id that has no live record.
 */
@Getter
public class ConnectionNotFoundException extends ResourceNotFoundException {

    private final String connectionId;

    public ConnectionNotFoundException(String connectionId) {
        super("Connection not found: " + connectionId);
        this.connectionId = connectionId;
    }
}
