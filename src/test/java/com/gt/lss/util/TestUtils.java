package com.gt.lss.util;

import com.gt.lss.model.CandidateItem;
import com.gt.lss.model.EligibleItem;
import com.gt.lss.model.EnrichedItem;
import com.gt.lss.model.ScoredItem;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class TestUtils {

    public static final Instant TEST_NOW = Instant.parse("2024-05-01T12:00:00Z");

    public static CandidateItem newItem(String id, double foundationalScore, double influenceScore, double difficultyScore, long canonicalOrder) {
        return new CandidateItem(id, foundationalScore, influenceScore, difficultyScore, 0.0, null, canonicalOrder);
    }

    public static CandidateItem dueItem(String id, double energy, double difficultyScore, int daysOverdue, long canonicalOrder) {
        return new CandidateItem(id, 0.5, 0.5, difficultyScore, energy, TEST_NOW.minus(Duration.ofDays(daysOverdue)), canonicalOrder);
    }

    public static CandidateItem futureItem(String id, double energy, int daysUntilDue, long canonicalOrder) {
        return new CandidateItem(id, 0.5, 0.5, 0.5, energy, TEST_NOW.plus(Duration.ofDays(daysUntilDue)), canonicalOrder);
    }

    public static EligibleItem eligible(CandidateItem item, double readiness) {
        return new EligibleItem(new EnrichedItem(item, List.of()), readiness);
    }

    // Scored items for composition tests, given in rank order with descending scores
    public static ScoredItem scored(CandidateItem item, double finalScore) {
        return new ScoredItem(item, 1.0, 0, finalScore);
    }
}
