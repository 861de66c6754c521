package com.gt.lss.model;

/**
 * Weights applied by the scoring engine. All weights are non-negative.
 */
public record Profile(double urgency, double readiness, double foundation, double influence) {

    public Profile {
        if (!isValidWeight(urgency) || !isValidWeight(readiness) || !isValidWeight(foundation) || !isValidWeight(influence)) {
            throw new IllegalArgumentException("Profile weights must be finite and non-negative. Received (" +
                    urgency + ", " + readiness + ", " + foundation + ", " + influence + ")");
        }
    }

    /**
     * Mixes this profile with another one, weight by weight.
     *
     * @param other the profile receiving the remaining share
     * @param ratio share of this profile, clamped to [0, 1]
     */
    public Profile blend(Profile other, double ratio) {
        double selfRatio = Math.max(0.0, Math.min(1.0, ratio));
        double otherRatio = 1.0 - selfRatio;

        return new Profile(
                urgency * selfRatio + other.urgency * otherRatio,
                readiness * selfRatio + other.readiness * otherRatio,
                foundation * selfRatio + other.foundation * otherRatio,
                influence * selfRatio + other.influence * otherRatio);
    }

    private static boolean isValidWeight(double weight) {
        return Double.isFinite(weight) && weight >= 0;
    }
}
