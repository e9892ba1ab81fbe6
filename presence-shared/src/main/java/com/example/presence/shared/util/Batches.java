package com.example.presence.shared.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits destructive operations into store-sized chunks.
 */
public final class Batches {

    private Batches() {}

    /**
     * Partitions {@code items} into consecutive sublists of at most {@code size} elements.
     * K items always yield ceil(K / size) batches.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + size);
        }
        List<List<T>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            batches.add(List.copyOf(items.subList(start, Math.min(start + size, items.size()))));
        }
        return batches;
    }
}
