package com.gt.lss.model;

import java.time.Instant;

/**
 * One schedulable item as seen by a single scheduling pass. Metadata scores and the user's memory state have
 * already been merged by the storage adapter; a missing memory state shows up as zero energy and a null due time.
 */
public record CandidateItem(String id,
                            double foundationalScore,
                            double influenceScore,
                            double difficultyScore,
                            double masteryEnergy,
                            Instant nextDueTime,
                            long canonicalOrder) {

    // Items without a structural position sort after every positioned item
    public static final long UNORDERED = Long.MAX_VALUE;

    public CandidateItem {
        // A zero timestamp means the item was never scheduled
        if (Instant.EPOCH.equals(nextDueTime)) {
            nextDueTime = null;
        }
    }

    public boolean isNew() {
        return masteryEnergy <= 0;
    }

    public boolean hasMemoryState() {
        return nextDueTime != null || masteryEnergy > 0;
    }

    public boolean isDue(Instant now) {
        return nextDueTime != null && !nextDueTime.isAfter(now);
    }
}
