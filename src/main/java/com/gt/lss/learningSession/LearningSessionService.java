package com.gt.lss.learningSession;

import com.gt.lss.bandit.BanditOptimizer;
import com.gt.lss.composition.SessionComposer;
import com.gt.lss.content.ContentDao;
import com.gt.lss.content.GoalService;
import com.gt.lss.exception.DaoException;
import com.gt.lss.gate.PrerequisiteGate;
import com.gt.lss.mastery.MasteryDao;
import com.gt.lss.model.*;
import com.gt.lss.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.*;

/**
 * Entry point for session generation: fetch, gate, score, compose. The personalized variants wrap it with the
 * bandit optimizer, choosing the weighting profile beforehand and rewarding it once the session is finished.
 */
@Component
public class LearningSessionService {

    private static final Logger log = LoggerFactory.getLogger(LearningSessionService.class);

    public static final int DEFAULT_MAX_SESSION_SIZE = 999;

    private final ContentDao contentDao;
    private final MasteryDao masteryDao;
    private final GoalService goalService;
    private final PrerequisiteGate prerequisiteGate;
    private final ScoringEngine scoringEngine;
    private final SessionComposer sessionComposer;
    private final BanditOptimizer banditOptimizer;
    private final int maxSessionSize;

    @Autowired
    public LearningSessionService(ContentDao contentDao,
                                  MasteryDao masteryDao,
                                  GoalService goalService,
                                  PrerequisiteGate prerequisiteGate,
                                  ScoringEngine scoringEngine,
                                  SessionComposer sessionComposer,
                                  BanditOptimizer banditOptimizer,
                                  @Value("${lss.session.maxSize:999}") int maxSessionSize) {
        if (maxSessionSize < 1) {
            throw new IllegalArgumentException("Maximum session size must be positive. Received " + maxSessionSize);
        }

        this.contentDao = contentDao;
        this.masteryDao = masteryDao;
        this.goalService = goalService;
        this.prerequisiteGate = prerequisiteGate;
        this.scoringEngine = scoringEngine;
        this.sessionComposer = sessionComposer;
        this.banditOptimizer = banditOptimizer;
        this.maxSessionSize = maxSessionSize;
    }

    /**
     * Builds one session for a user and goal.
     *
     * @return up to {@code sessionSize} item ids in rank order; empty when the goal has nothing to schedule
     * @throws DaoException when candidates, prerequisites or energies cannot be retrieved
     */
    public List<String> generateSession(String userId, String goalId, Profile profile, int sessionSize, Instant now, SessionMode mode) {
        validateRequest(userId, goalId, now, mode);
        if (profile == null) {
            throw new IllegalArgumentException("A scoring profile is required");
        }
        if (sessionSize < 0) {
            throw new IllegalArgumentException("Session size cannot be negative. Received " + sessionSize);
        }

        if (sessionSize == 0) {
            return List.of();
        }
        if (sessionSize > maxSessionSize) {
            log.warn("Requested session size {} exceeds the maximum, using {}", sessionSize, maxSessionSize);
            sessionSize = maxSessionSize;
        }

        List<CandidateItem> candidates = sessionComposer.filterForMode(fetchCandidates(goalId, userId, now), mode, now);
        if (candidates.isEmpty()) {
            log.info("No {} candidates for user {} in goal {}", mode, userId, goalId);
            return List.of();
        }

        List<EnrichedItem> enrichedItems = enrichItems(candidates);
        Map<String, Double> parentEnergies = fetchParentEnergies(userId, enrichedItems);

        List<EligibleItem> eligibleItems = prerequisiteGate.apply(enrichedItems, parentEnergies);
        List<ScoredItem> rankedItems = scoringEngine.rank(eligibleItems, profile, now);
        List<String> session = sessionComposer.compose(rankedItems, sessionSize, mode);

        log.info("Generated {} session of {} items for user {} in goal {} ({} candidates, {} eligible)",
                mode, session.size(), userId, goalId, candidates.size(), eligibleItems.size());

        return session;
    }

    /**
     * Picks a weighting profile with the bandit optimizer, blends it with the safe profile and generates a session
     * with the result.
     */
    public SessionPlan generatePersonalizedSession(String userId, String goalId, int sessionSize, Instant now, SessionMode mode) {
        validateRequest(userId, goalId, now, mode);

        String goalGroup = getGoalGroup(goalId);
        ProfileName chosenProfile = banditOptimizer.chooseArm(userId, goalGroup);
        Profile effectiveProfile = banditOptimizer.blend(chosenProfile);

        List<String> itemIds = generateSession(userId, goalId, effectiveProfile, sessionSize, now, mode);

        log.info("Personalized session for user {} in goal group {} used profile {}", userId, goalGroup, chosenProfile);

        return new SessionPlan(userId, goalId, goalGroup, mode, chosenProfile, effectiveProfile, itemIds);
    }

    // Rewards the arm that produced the plan
    public BanditArmState completePersonalizedSession(SessionPlan sessionPlan, String userId, SessionResult sessionResult) {
        if (sessionPlan == null || sessionResult == null) {
            throw new IllegalArgumentException("A session plan and a session result are required");
        }
        if (!StringUtils.hasText(userId) || !userId.equals(sessionPlan.userId())) {
            throw new IllegalArgumentException("Session plan for user " + sessionPlan.userId() + " cannot be completed by user " + userId);
        }

        double reward = rewardSession(sessionResult);

        return banditOptimizer.updateArm(userId, sessionPlan.goalGroup(), sessionPlan.chosenProfile(), reward);
    }

    public double rewardSession(SessionResult sessionResult) {
        return banditOptimizer.rewardSession(sessionResult);
    }

    public ProfileName chooseArm(String userId, String goalGroup) {
        return banditOptimizer.chooseArm(userId, goalGroup);
    }

    public BanditArmState updateArm(String userId, String goalGroup, ProfileName profileName, double reward) {
        return banditOptimizer.updateArm(userId, goalGroup, profileName, reward);
    }

    String getGoalGroup(String goalId) {
        try {
            Optional<Goal> goal = goalService.getGoal(goalId);
            if (goal.isPresent() && StringUtils.hasText(goal.get().goalGroup())) {
                return goal.get().goalGroup();
            }
        } catch (Exception ex) {
            log.warn("Unable to load goal {}, personalizing with the default goal group", goalId, ex);
        }

        return Goal.DEFAULT_GOAL_GROUP;
    }

    private List<CandidateItem> fetchCandidates(String goalId, String userId, Instant now) {
        try {
            return contentDao.fetchCandidates(goalId, userId, now);
        } catch (Exception ex) {
            String errMsg = "Failed to fetch candidates for user " + userId + " in goal " + goalId;
            log.error(errMsg, ex);
            throw new DaoException(errMsg, ex);
        }
    }

    private List<EnrichedItem> enrichItems(List<CandidateItem> candidates) {
        List<String> itemIds = new ArrayList<>(candidates.size());
        for (CandidateItem candidate : candidates) {
            itemIds.add(candidate.id());
        }

        Map<String, List<String>> parentIdsByChildId;
        try {
            parentIdsByChildId = contentDao.fetchPrerequisiteParents(itemIds);
        } catch (Exception ex) {
            String errMsg = "Failed to fetch prerequisite parents for " + itemIds.size() + " items";
            log.error(errMsg, ex);
            throw new DaoException(errMsg, ex);
        }

        List<EnrichedItem> enrichedItems = new ArrayList<>(candidates.size());
        for (CandidateItem candidate : candidates) {
            enrichedItems.add(new EnrichedItem(candidate, parentIdsByChildId.getOrDefault(candidate.id(), List.of())));
        }

        return enrichedItems;
    }

    private Map<String, Double> fetchParentEnergies(String userId, List<EnrichedItem> enrichedItems) {
        Set<String> parentIds = new LinkedHashSet<>();
        for (EnrichedItem enrichedItem : enrichedItems) {
            parentIds.addAll(enrichedItem.parentIds());
        }

        if (parentIds.isEmpty()) {
            return Map.of();
        }

        try {
            return masteryDao.fetchEnergies(userId, parentIds);
        } catch (Exception ex) {
            String errMsg = "Failed to fetch energies of " + parentIds.size() + " prerequisite items for user " + userId;
            log.error(errMsg, ex);
            throw new DaoException(errMsg, ex);
        }
    }

    private static void validateRequest(String userId, String goalId, Instant now, SessionMode mode) {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("A user id is required");
        }
        if (!StringUtils.hasText(goalId)) {
            throw new IllegalArgumentException("A goal id is required");
        }
        if (now == null) {
            throw new IllegalArgumentException("The current time is required");
        }
        if (mode == null) {
            throw new IllegalArgumentException("A session mode is required");
        }
    }
}
