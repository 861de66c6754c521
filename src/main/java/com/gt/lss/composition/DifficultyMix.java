package com.gt.lss.composition;

public record DifficultyMix(double easyRatio, double mediumRatio, double hardRatio) {

    public static final DifficultyMix DEFAULT = new DifficultyMix(0.6, 0.3, 0.1);

    public DifficultyMix {
        MixValidation.validateRatios("difficulty", easyRatio, mediumRatio, hardRatio);
    }
}
