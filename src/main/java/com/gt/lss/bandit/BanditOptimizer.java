package com.gt.lss.bandit;

import com.gt.lss.exception.DaoException;
import com.gt.lss.model.BanditArmState;
import com.gt.lss.model.Profile;
import com.gt.lss.model.ProfileName;
import com.gt.lss.model.SessionResult;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Supplier;

/**
 * Thompson sampling over the weighting presets, one Beta(successes, failures) arm per preset and per
 * (user, goal group).
 */
@Component
public class BanditOptimizer {

    private static final Logger log = LoggerFactory.getLogger(BanditOptimizer.class);

    private static final double ACCURACY_WEIGHT = 0.6;
    private static final double COMPLETION_WEIGHT = 0.4;

    private final BanditArmDao banditArmDao;
    private final Supplier<RandomGenerator> randomSupplier;
    private final double blendRatio;
    private final ProfileName safeProfileName;

    @Autowired
    public BanditOptimizer(BanditArmDao banditArmDao,
                           Supplier<RandomGenerator> randomSupplier,
                           @Value("${lss.bandit.blendRatio:0.8}") double blendRatio,
                           @Value("${lss.bandit.safeProfile:Balanced}") String safeProfile) {
        if (!(blendRatio >= 0.0 && blendRatio <= 1.0)) {
            throw new IllegalArgumentException("Blend ratio must be within [0, 1]. Received " + blendRatio);
        }

        ProfileName safeProfileName = ProfileName.getProfileNameByName(safeProfile);
        if (safeProfileName == null) {
            throw new IllegalArgumentException("Unknown safe profile " + safeProfile);
        }

        this.banditArmDao = banditArmDao;
        this.randomSupplier = randomSupplier;
        this.blendRatio = blendRatio;
        this.safeProfileName = safeProfileName;
    }

    /**
     * Draws one sample per arm and returns the preset with the highest draw. Falls back to the safe profile when
     * the arm statistics cannot be read.
     */
    public ProfileName chooseArm(String userId, String goalGroup) {
        List<BanditArmState> storedArms;
        try {
            storedArms = banditArmDao.fetchBanditArms(userId, goalGroup);
        } catch (Exception ex) {
            log.warn("Unable to load bandit arms for user {} in goal group {}, using {}", userId, goalGroup, safeProfileName, ex);
            return safeProfileName;
        }

        if (storedArms.isEmpty()) {
            storedArms = initializeArms(userId, goalGroup);
        }

        Map<ProfileName, BanditArmState> armsByProfile = new EnumMap<>(ProfileName.class);
        for (BanditArmState arm : storedArms) {
            if (arm.profileName() != null) {
                armsByProfile.put(arm.profileName(), arm);
            }
        }

        RandomGenerator random = randomSupplier.get();
        ProfileName bestProfile = safeProfileName;
        double bestSample = Double.NEGATIVE_INFINITY;

        for (ProfileName profileName : ProfileName.values()) {
            BanditArmState arm = armsByProfile.get(profileName);
            if (arm == null) {
                arm = BanditArmState.initial(userId, goalGroup, profileName);
            }

            double sample = sampleArm(arm, random);
            if (sample > bestSample) {
                bestSample = sample;
                bestProfile = profileName;
            }
        }

        log.debug("Chose profile {} for user {} in goal group {}", bestProfile, userId, goalGroup);

        return bestProfile;
    }

    /**
     * Seeds every preset arm at the uniform prior. Arms that already exist in the store keep their statistics.
     * Persisting is best effort; the returned priors are usable either way.
     */
    public List<BanditArmState> initializeArms(String userId, String goalGroup) {
        List<BanditArmState> arms = new ArrayList<>();

        for (ProfileName profileName : ProfileName.values()) {
            arms.add(BanditArmState.initial(userId, goalGroup, profileName));
        }

        try {
            for (BanditArmState arm : arms) {
                banditArmDao.insertBanditArmIfAbsent(userId, goalGroup, arm.profileName().name(), arm.successes(), arm.failures());
            }
        } catch (Exception ex) {
            log.warn("Unable to persist initial bandit arms for user {} in goal group {}", userId, goalGroup, ex);
        }

        return arms;
    }

    // The chosen preset pulled toward the safe preset
    public Profile blend(ProfileName chosenProfile) {
        return chosenProfile.getProfile().blend(safeProfileName.getProfile(), blendRatio);
    }

    public double rewardSession(SessionResult sessionResult) {
        double accuracy = (double) sessionResult.correct() / Math.max(sessionResult.total(), 1);
        double completion = (double) sessionResult.completed() / Math.max(sessionResult.presented(), 1);

        return clamp(ACCURACY_WEIGHT * accuracy + COMPLETION_WEIGHT * completion);
    }

    /**
     * Adds a reward to one arm. The store applies the increment atomically, so concurrent rewards to the same arm
     * are never lost, across service instances included.
     */
    public BanditArmState updateArm(String userId, String goalGroup, ProfileName profileName, double reward) {
        double clampedReward = clamp(reward);

        try {
            BanditArmState updatedArm = banditArmDao.incrementBanditArm(userId, goalGroup, profileName.name(), clampedReward);

            log.debug("Updated arm {} for user {} in goal group {} to ({}, {})",
                    profileName, userId, goalGroup, updatedArm.successes(), updatedArm.failures());

            return updatedArm;
        } catch (Exception ex) {
            String errMsg = "Failed to update bandit arm " + profileName + " for user " + userId + " in goal group " + goalGroup;
            log.error(errMsg, ex);
            throw new DaoException(errMsg, ex);
        }
    }

    private static double sampleArm(BanditArmState arm, RandomGenerator random) {
        double alpha = Math.max(arm.successes(), Double.MIN_NORMAL);
        double beta = Math.max(arm.failures(), Double.MIN_NORMAL);

        return new BetaDistribution(random, alpha, beta).sample();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
