package com.gt.lss.composition;

import com.gt.lss.model.CandidateItem;
import com.gt.lss.model.ScoredItem;
import com.gt.lss.model.SessionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Mode specific candidate filtering and bucketed session composition.
 *
 * <ul>
 *     <li>Revision: only items the user has already studied that are due, mixed by difficulty.</li>
 *     <li>MixedLearning: due or new items, mixed by mastery band.</li>
 * </ul>
 *
 * Composition only considers the head of the ranking, {@code candidatePoolMultiplier * sessionSize} items.
 */
@Component
public class SessionComposer {

    private static final Logger log = LoggerFactory.getLogger(SessionComposer.class);

    private final int candidatePoolMultiplier;
    private final DifficultyComposition difficultyComposition;
    private final MasteryBandComposition masteryBandComposition;

    @Autowired
    public SessionComposer(@Value("${lss.session.candidatePoolMultiplier:3}") int candidatePoolMultiplier,
                           @Value("${lss.session.revision.easyRatio:0.6}") double easyRatio,
                           @Value("${lss.session.revision.mediumRatio:0.3}") double mediumRatio,
                           @Value("${lss.session.revision.hardRatio:0.1}") double hardRatio,
                           @Value("${lss.session.mixed.newRatio:0.1}") double newRatio,
                           @Value("${lss.session.mixed.almostMasteredRatio:0.1}") double almostMasteredRatio,
                           @Value("${lss.session.mixed.almostThereRatio:0.5}") double almostThereRatio,
                           @Value("${lss.session.mixed.strugglingRatio:0.2}") double strugglingRatio,
                           @Value("${lss.session.mixed.reallyStrugglingRatio:0.1}") double reallyStrugglingRatio,
                           @Value("${lss.session.mixed.minNewPerSession:0}") int minNewPerSession) {
        this(candidatePoolMultiplier,
                new DifficultyMix(easyRatio, mediumRatio, hardRatio),
                new MasteryBandMix(newRatio, almostMasteredRatio, almostThereRatio, strugglingRatio, reallyStrugglingRatio, minNewPerSession));
    }

    public SessionComposer(int candidatePoolMultiplier, DifficultyMix difficultyMix, MasteryBandMix masteryBandMix) {
        if (candidatePoolMultiplier < 1) {
            throw new IllegalArgumentException("Candidate pool multiplier must be at least 1. Received " + candidatePoolMultiplier);
        }

        this.candidatePoolMultiplier = candidatePoolMultiplier;
        this.difficultyComposition = new DifficultyComposition(difficultyMix);
        this.masteryBandComposition = new MasteryBandComposition(masteryBandMix);
    }

    public boolean isCandidateForMode(CandidateItem item, SessionMode mode, Instant now) {
        if (mode == SessionMode.Revision) {
            return item.hasMemoryState() && item.isDue(now);
        }

        return item.isNew() || item.isDue(now);
    }

    public List<CandidateItem> filterForMode(List<CandidateItem> candidates, SessionMode mode, Instant now) {
        return candidates.stream()
                .filter(item -> isCandidateForMode(item, mode, now))
                .collect(Collectors.toList());
    }

    /**
     * @param rankedItems eligible items in rank order
     * @return up to {@code sessionSize} item ids, in rank order
     */
    public List<String> compose(List<ScoredItem> rankedItems, int sessionSize, SessionMode mode) {
        if (sessionSize <= 0 || rankedItems.isEmpty()) {
            return List.of();
        }

        long poolSize = Math.min((long) sessionSize * candidatePoolMultiplier, rankedItems.size());
        List<ScoredItem> pool = rankedItems.subList(0, (int) poolSize);

        List<String> session = mode == SessionMode.Revision
                ? difficultyComposition.compose(pool, sessionSize)
                : masteryBandComposition.compose(pool, sessionSize);

        log.debug("Composed {} session of {} items from a pool of {}", mode, session.size(), pool.size());

        return session;
    }
}
