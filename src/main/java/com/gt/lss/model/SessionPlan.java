package com.gt.lss.model;

import java.util.List;

/**
 * A generated session together with the personalization decision behind it. Handed back on completion so the
 * chosen arm can be rewarded.
 */
public record SessionPlan(String userId,
                          String goalId,
                          String goalGroup,
                          SessionMode mode,
                          ProfileName chosenProfile,
                          Profile effectiveProfile,
                          List<String> itemIds) { }
