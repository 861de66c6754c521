package com.gt.lss.model;

// Goal membership lives in goal_items and is resolved by the candidate query
public record Goal(String id, String goalGroup, String label) {

    public static final String DEFAULT_GOAL_GROUP = "default";
}
