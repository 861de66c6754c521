package com.gt.lss.util;

import com.gt.lss.bandit.BanditArmDao;
import com.gt.lss.model.BanditArmState;
import com.gt.lss.model.ProfileName;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryBanditArmDao implements BanditArmDao {

    private final Map<String, BanditArmState> arms = new ConcurrentHashMap<>();
    private final AtomicInteger insertCount = new AtomicInteger();

    private volatile RuntimeException fetchFailure;

    public void failFetch(RuntimeException ex) {
        this.fetchFailure = ex;
    }

    public int getInsertCount() {
        return insertCount.get();
    }

    public BanditArmState getArm(String userId, String goalGroup, ProfileName profileName) {
        return arms.get(key(userId, goalGroup, profileName.name()));
    }

    @Override
    public List<BanditArmState> fetchBanditArms(String userId, String goalGroup) {
        if (fetchFailure != null) {
            throw fetchFailure;
        }

        List<BanditArmState> userArms = new ArrayList<>();
        for (BanditArmState arm : arms.values()) {
            if (arm.userId().equals(userId) && arm.goalGroup().equals(goalGroup)) {
                userArms.add(arm);
            }
        }

        return userArms;
    }

    @Override
    public void insertBanditArmIfAbsent(String userId, String goalGroup, String profileName, double successes, double failures) {
        insertCount.incrementAndGet();
        arms.putIfAbsent(key(userId, goalGroup, profileName),
                new BanditArmState(userId, goalGroup, ProfileName.getProfileNameByName(profileName), successes, failures));
    }

    @Override
    public BanditArmState incrementBanditArm(String userId, String goalGroup, String profileName, double reward) {
        return arms.compute(key(userId, goalGroup, profileName), (key, arm) -> {
            BanditArmState currentArm = arm != null
                    ? arm
                    : BanditArmState.initial(userId, goalGroup, ProfileName.getProfileNameByName(profileName));

            return currentArm.withReward(reward);
        });
    }

    private static String key(String userId, String goalGroup, String profileName) {
        return userId + "|" + goalGroup + "|" + profileName;
    }
}
