package com.example.presence.realtime.reactor;

import java.util.Set;

/**
 * Decides who should hear that a user came online or went offline.
 */
@FunctionalInterface
public interface CollaboratorResolver {

    /**
     * @return user ids of the collaborators of {@code userId}, never null
     */
    Set<String> collaboratorsOf(String userId);
}
