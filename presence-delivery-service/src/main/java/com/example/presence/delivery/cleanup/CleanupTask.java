package com.example.presence.delivery.cleanup;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum CleanupTask {
    EXPIRE_NOTIFICATIONS,
    CLEANUP_OLD_NOTIFICATIONS,
    CLEANUP_DELIVERY_RECORDS,
    AGGREGATE_METRICS,
    CLEANUP_ORPHANED_RECORDS;

    public static final String ALL = "ALL";

    /**
     * Resolves task names, case-insensitively. Empty input or {@code ALL} selects every task.
     *
     * @throws IllegalArgumentException on an unknown task name
     */
    public static Set<CleanupTask> parse(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return EnumSet.allOf(CleanupTask.class);
        }
        Set<CleanupTask> tasks = EnumSet.noneOf(CleanupTask.class);
        for (String name : names) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            if (normalized.isEmpty()) {
                continue;
            }
            if (ALL.equals(normalized)) {
                return EnumSet.allOf(CleanupTask.class);
            }
            try {
                tasks.add(CleanupTask.valueOf(normalized));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown cleanup task: " + name + ". Valid tasks: "
                        + EnumSet.allOf(CleanupTask.class) + " or " + ALL);
            }
        }
        return tasks.isEmpty() ? EnumSet.allOf(CleanupTask.class) : tasks;
    }
}
