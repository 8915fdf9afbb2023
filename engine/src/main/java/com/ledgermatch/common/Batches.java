package com.ledgermatch.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size chunking for requests with a per-call item limit.
 */
public final class Batches {

    private Batches() {
    }

    /**
     * Consecutive slices of at most {@code size} items, in order. Slices are copies.
     */
    public static <T> List<List<T>> chunk(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<List<T>> chunks = new ArrayList<>((items.size() + size - 1) / size);
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(List.copyOf(items.subList(i, Math.min(i + size, items.size()))));
        }
        return chunks;
    }
}
