package com.gt.lss.composition;

public enum MasteryBand {
    New,                // 0
    ReallyStruggling,   // (0, 0.2]
    Struggling,         // (0.2, 0.4]
    AlmostThere,        // (0.4, 0.7]
    AlmostMastered;     // (0.7, 1.0]

    public static MasteryBand fromEnergy(double energy) {
        if (energy <= 0.0) {
            return New;
        } else if (energy <= 0.2) {
            return ReallyStruggling;
        } else if (energy <= 0.4) {
            return Struggling;
        } else if (energy <= 0.7) {
            return AlmostThere;
        }

        return AlmostMastered;
    }
}
