package com.gt.lss.composition;

public enum DifficultyBucket {
    Easy,
    Medium,
    Hard;

    public static DifficultyBucket fromScore(double difficultyScore) {
        if (difficultyScore < 0.4) {
            return Easy;
        } else if (difficultyScore < 0.7) {
            return Medium;
        }

        return Hard;
    }
}
