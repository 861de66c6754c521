package com.gt.lss.composition;

/**
 * Mastery band shares for mixed learning sessions. {@code minNewPerSession} raises the New target when the
 * ratio alone would round down below it.
 */
public record MasteryBandMix(double newRatio,
                             double almostMasteredRatio,
                             double almostThereRatio,
                             double strugglingRatio,
                             double reallyStrugglingRatio,
                             int minNewPerSession) {

    public static final MasteryBandMix DEFAULT = new MasteryBandMix(0.1, 0.1, 0.5, 0.2, 0.1, 0);

    public MasteryBandMix {
        MixValidation.validateRatios("mastery band", newRatio, almostMasteredRatio, almostThereRatio, strugglingRatio, reallyStrugglingRatio);

        if (minNewPerSession < 0) {
            throw new IllegalArgumentException("Minimum new items per session cannot be negative. Received " + minNewPerSession);
        }
    }
}
