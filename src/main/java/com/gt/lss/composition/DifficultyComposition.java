package com.gt.lss.composition;

import com.gt.lss.model.ScoredItem;

import java.util.LinkedHashMap;

// Revision sessions: buckets by content difficulty
public class DifficultyComposition extends BucketComposition<DifficultyBucket> {

    private final DifficultyMix mix;

    public DifficultyComposition(DifficultyMix mix) {
        this.mix = mix;
    }

    @Override
    protected DifficultyBucket bucketOf(ScoredItem item) {
        return DifficultyBucket.fromScore(item.item().difficultyScore());
    }

    @Override
    protected LinkedHashMap<DifficultyBucket, Integer> calculateTargets(int sessionSize) {
        LinkedHashMap<DifficultyBucket, Integer> targets = new LinkedHashMap<>();

        int easy = roundedTarget(mix.easyRatio(), sessionSize, 0);
        int medium = roundedTarget(mix.mediumRatio(), sessionSize, easy);

        targets.put(DifficultyBucket.Easy, easy);
        targets.put(DifficultyBucket.Medium, medium);
        targets.put(DifficultyBucket.Hard, Math.max(0, sessionSize - easy - medium));

        return targets;
    }
}
