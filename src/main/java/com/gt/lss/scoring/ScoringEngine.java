package com.gt.lss.scoring;

import com.gt.lss.model.CandidateItem;
import com.gt.lss.model.EligibleItem;
import com.gt.lss.model.Profile;
import com.gt.lss.model.ScoredItem;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks eligible items by urgency and learning potential.
 *
 * <pre>
 * urgencyFactor     = 1 + w.urgency * ln(1 + daysOverdue)
 * learningPotential = w.readiness * readiness + w.foundation * foundationalScore + w.influence * influenceScore
 * finalScore        = urgencyFactor * learningPotential
 * </pre>
 *
 * Ranking is by final score descending, then canonical order ascending. The item id settles anything left so the
 * order is fully reproducible.
 */
@Component
public class ScoringEngine {

    public static final Comparator<ScoredItem> RANK_ORDER = Comparator
            .comparingDouble(ScoredItem::finalScore).reversed()
            .thenComparingLong(scoredItem -> scoredItem.item().canonicalOrder())
            .thenComparing(ScoredItem::id);

    public List<ScoredItem> rank(List<EligibleItem> eligibleItems, Profile profile, Instant now) {
        List<ScoredItem> scoredItems = new ArrayList<>(eligibleItems.size());

        for (EligibleItem eligibleItem : eligibleItems) {
            scoredItems.add(score(eligibleItem, profile, now));
        }

        scoredItems.sort(RANK_ORDER);

        return scoredItems;
    }

    public ScoredItem score(EligibleItem eligibleItem, Profile profile, Instant now) {
        CandidateItem item = eligibleItem.item();
        long daysOverdue = calculateDaysOverdue(item.nextDueTime(), now);

        return new ScoredItem(item, eligibleItem.readiness(), daysOverdue,
                calculateFinalScore(profile, eligibleItem.readiness(), item.foundationalScore(), item.influenceScore(), daysOverdue));
    }

    public static long calculateDaysOverdue(Instant nextDueTime, Instant now) {
        if (nextDueTime == null || !nextDueTime.isBefore(now)) {
            return 0;
        }

        return Duration.between(nextDueTime, now).toDays();
    }

    public static double calculateFinalScore(Profile profile, double readiness, double foundationalScore, double influenceScore, long daysOverdue) {
        double urgencyFactor = 1.0 + profile.urgency() * Math.log(1.0 + Math.max(0, daysOverdue));
        double learningPotential = profile.readiness() * readiness
                + profile.foundation() * foundationalScore
                + profile.influence() * influenceScore;

        return urgencyFactor * learningPotential;
    }
}
