package com.gt.lss.composition;

import java.util.Arrays;

class MixValidation {

    private static final double SUM_TOLERANCE = 0.01;

    static void validateRatios(String mixName, double... ratios) {
        double sum = 0.0;
        for (double ratio : ratios) {
            if (!Double.isFinite(ratio) || ratio < 0) {
                throw new IllegalArgumentException("Invalid " + mixName + " ratio " + ratio + " in " + Arrays.toString(ratios));
            }
            sum += ratio;
        }

        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("The " + mixName + " ratios must sum to 1.0. Received " + Arrays.toString(ratios));
        }
    }
}
