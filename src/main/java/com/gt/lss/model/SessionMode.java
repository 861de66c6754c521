package com.gt.lss.model;

public enum SessionMode {
    Revision,
    MixedLearning
}
