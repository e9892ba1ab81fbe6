package com.example.presence.shared.service.broadcast;

public enum DeliveryOutcome {
    DELIVERED,
    /** The target no longer exists; it is deregistered. */
    GONE,
    TRANSIENT_ERROR
}
