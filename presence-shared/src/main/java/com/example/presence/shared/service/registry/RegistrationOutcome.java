package com.example.presence.shared.service.registry;

/**
 * Result of a create-only-if-absent registration. A duplicate id is a conflict, not an error.
 */
public enum RegistrationOutcome {
    REGISTERED,
    ALREADY_EXISTS
}
