package com.gt.lss.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class BatchUtil {

    /**
     * Splits identifiers into consecutive chunks of at most {@code chunkSize}, preserving iteration order.
     * Used to keep IN-list queries under the backend's bind parameter limit.
     */
    public static <T> List<List<T>> partition(Collection<T> values, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive. Received " + chunkSize);
        }
        if (values == null || values.isEmpty()) {
            return List.of();
        }

        List<T> valueList = new ArrayList<>(values);
        List<List<T>> chunks = new ArrayList<>();
        for (int start = 0; start < valueList.size(); start += chunkSize) {
            chunks.add(List.copyOf(valueList.subList(start, Math.min(start + chunkSize, valueList.size()))));
        }

        return chunks;
    }
}
