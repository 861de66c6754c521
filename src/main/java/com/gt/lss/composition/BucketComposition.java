package com.gt.lss.composition;

import com.gt.lss.model.ScoredItem;

import java.util.*;

/**
 * Fills a session from ranked items using per-bucket quotas.
 *
 * <p>Each bucket contributes its best ranked items up to its target. Slots a bucket cannot fill are backfilled
 * from every other unselected item in global rank order. Buckets never re-sort; the selected items are returned
 * in global rank order.</p>
 *
 * @param <B> the bucket type
 */
public abstract class BucketComposition<B extends Enum<B>> {

    protected abstract B bucketOf(ScoredItem item);

    /**
     * Targets per bucket, in the order they are populated. The targets never add up to more than
     * {@code sessionSize}.
     */
    protected abstract LinkedHashMap<B, Integer> calculateTargets(int sessionSize);

    public List<String> compose(List<ScoredItem> rankedItems, int sessionSize) {
        if (sessionSize <= 0 || rankedItems.isEmpty()) {
            return List.of();
        }

        Map<B, Integer> targets = calculateTargets(sessionSize);
        Map<B, Integer> selectedPerBucket = new HashMap<>();
        boolean[] selected = new boolean[rankedItems.size()];
        int selectedCount = 0;

        for (int index = 0; index < rankedItems.size() && selectedCount < sessionSize; index++) {
            B bucket = bucketOf(rankedItems.get(index));
            int bucketCount = selectedPerBucket.getOrDefault(bucket, 0);

            if (bucketCount < targets.getOrDefault(bucket, 0)) {
                selected[index] = true;
                selectedPerBucket.put(bucket, bucketCount + 1);
                selectedCount++;
            }
        }

        // Backfill under-populated buckets
        for (int index = 0; index < rankedItems.size() && selectedCount < sessionSize; index++) {
            if (!selected[index]) {
                selected[index] = true;
                selectedCount++;
            }
        }

        List<String> session = new ArrayList<>(selectedCount);
        for (int index = 0; index < rankedItems.size(); index++) {
            if (selected[index]) {
                session.add(rankedItems.get(index).id());
            }
        }

        return session;
    }

    /**
     * Rounds {@code ratio * sessionSize}, limited to what is still unallocated.
     */
    protected static int roundedTarget(double ratio, int sessionSize, int allocated) {
        int remaining = Math.max(0, sessionSize - allocated);

        return (int) Math.min(Math.round(ratio * sessionSize), remaining);
    }
}
