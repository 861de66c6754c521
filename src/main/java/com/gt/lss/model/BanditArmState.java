package com.gt.lss.model;

public record BanditArmState(String userId, String goalGroup, ProfileName profileName, double successes, double failures) {

    public static final double PRIOR_SUCCESSES = 1.0;
    public static final double PRIOR_FAILURES = 1.0;

    public static BanditArmState initial(String userId, String goalGroup, ProfileName profileName) {
        return new BanditArmState(userId, goalGroup, profileName, PRIOR_SUCCESSES, PRIOR_FAILURES);
    }

    public BanditArmState withReward(double reward) {
        double clampedReward = Math.max(0.0, Math.min(1.0, reward));

        return new BanditArmState(userId, goalGroup, profileName, successes + clampedReward, failures + (1.0 - clampedReward));
    }

    public double expectedMean() {
        return successes / (successes + failures);
    }
}
