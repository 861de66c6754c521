package com.gt.lss.model;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Named weighting presets. Each preset is one arm of the bandit optimizer, and its name is the key the arm
 * statistics are persisted under.
 */
public enum ProfileName {

    Balanced(new Profile(1.0, 1.0, 1.0, 1.0)),
    FoundationHeavy(new Profile(0.8, 1.0, 1.5, 0.8)),
    InfluenceHeavy(new Profile(0.8, 1.0, 0.8, 1.5)),
    UrgencyHeavy(new Profile(1.5, 0.8, 1.0, 1.0)),
    ReadinessFocused(new Profile(0.8, 1.5, 1.0, 1.0));

    private final Profile profile;

    ProfileName(Profile profile) {
        this.profile = profile;
    }

    private static final Map<String, ProfileName> profileNameByName = Arrays.stream(ProfileName.values()).collect(Collectors.toMap(pn -> pn.name(), pn -> pn));

    // Returns null for names that are not a known preset
    public static ProfileName getProfileNameByName(String name) {
        return name == null ? null : profileNameByName.get(name);
    }

    public Profile getProfile() {
        return profile;
    }
}
