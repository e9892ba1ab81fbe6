package com.example.presence.realtime.protocol;

/**
 * Identity of the socket a frame arrived on.
 */
public record SessionContext(String connectionId, String userId) {
}
