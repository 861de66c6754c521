package com.gt.lss.bandit;

import com.gt.lss.model.BanditArmState;

import java.util.List;

public interface BanditArmDao {

    List<BanditArmState> fetchBanditArms(String userId, String goalGroup);

    // Seeds an arm; an existing row for the same key is left untouched
    void insertBanditArmIfAbsent(String userId, String goalGroup, String profileName, double successes, double failures);

    /**
     * Atomically adds {@code reward} to successes and {@code 1 - reward} to failures, creating the arm from the prior
     * when it does not exist yet.
     *
     * @return the arm state after the increment
     */
    BanditArmState incrementBanditArm(String userId, String goalGroup, String profileName, double reward);
}
