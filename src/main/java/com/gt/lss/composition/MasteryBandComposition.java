package com.gt.lss.composition;

import com.gt.lss.model.ScoredItem;

import java.util.LinkedHashMap;

// Mixed learning sessions: buckets by the user's mastery energy
public class MasteryBandComposition extends BucketComposition<MasteryBand> {

    private final MasteryBandMix mix;

    public MasteryBandComposition(MasteryBandMix mix) {
        this.mix = mix;
    }

    @Override
    protected MasteryBand bucketOf(ScoredItem item) {
        return MasteryBand.fromEnergy(item.item().masteryEnergy());
    }

    @Override
    protected LinkedHashMap<MasteryBand, Integer> calculateTargets(int sessionSize) {
        LinkedHashMap<MasteryBand, Integer> targets = new LinkedHashMap<>();

        int newTarget = Math.min(Math.max(roundedTarget(mix.newRatio(), sessionSize, 0), mix.minNewPerSession()), sessionSize);
        int allocated = newTarget;
        targets.put(MasteryBand.New, newTarget);

        int almostMastered = roundedTarget(mix.almostMasteredRatio(), sessionSize, allocated);
        allocated += almostMastered;
        targets.put(MasteryBand.AlmostMastered, almostMastered);

        int almostThere = roundedTarget(mix.almostThereRatio(), sessionSize, allocated);
        allocated += almostThere;
        targets.put(MasteryBand.AlmostThere, almostThere);

        int struggling = roundedTarget(mix.strugglingRatio(), sessionSize, allocated);
        allocated += struggling;
        targets.put(MasteryBand.Struggling, struggling);

        targets.put(MasteryBand.ReallyStruggling, Math.max(0, sessionSize - allocated));

        return targets;
    }
}
