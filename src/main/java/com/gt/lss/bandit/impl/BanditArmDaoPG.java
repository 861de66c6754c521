package com.gt.lss.bandit.impl;

import com.gt.lss.bandit.BanditArmDao;
import com.gt.lss.model.BanditArmState;
import com.gt.lss.model.ProfileName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class BanditArmDaoPG implements BanditArmDao {

    private static final Logger log = LoggerFactory.getLogger(BanditArmDaoPG.class);

    private static final String FETCH_BANDIT_ARMS_SQL =
            "SELECT user_id, goal_group, profile_name, successes, failures " +
            "FROM user_bandit_state " +
            "WHERE user_id = :userId AND goal_group = :goalGroup";

    private static final String INSERT_BANDIT_ARM_IF_ABSENT_SQL =
            "INSERT INTO user_bandit_state " +
                    "(user_id, goal_group, profile_name, successes, failures, update_instant) " +
                    "VALUES (:userId, :goalGroup, :profileName, :successes, :failures, :updateInstant) " +
            "ON CONFLICT DO NOTHING";

    private static final String INCREMENT_BANDIT_ARM_SQL =
            "INSERT INTO user_bandit_state " +
                    "(user_id, goal_group, profile_name, successes, failures, update_instant) " +
                    "VALUES (:userId, :goalGroup, :profileName, :initialSuccesses, :initialFailures, :updateInstant) " +
            "ON CONFLICT (user_id, goal_group, profile_name) DO UPDATE " +
                    "SET successes = user_bandit_state.successes + :reward, " +
                        "failures = user_bandit_state.failures + :penalty, " +
                        "update_instant = :updateInstant " +
            "RETURNING user_id, goal_group, profile_name, successes, failures";

    private final NamedParameterJdbcTemplate template;

    public BanditArmDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<BanditArmState> fetchBanditArms(String userId, String goalGroup) {
        List<BanditArmState> arms = new ArrayList<>();

        template.query(FETCH_BANDIT_ARMS_SQL, Map.of("userId", userId, "goalGroup", goalGroup), rs -> {
            String profileNameValue = rs.getString("profile_name");
            ProfileName profileName = ProfileName.getProfileNameByName(profileNameValue);

            if (profileName == null) {
                log.warn("Ignoring bandit arm with unknown profile {} for user {} in goal group {}", profileNameValue, userId, goalGroup);
            } else {
                arms.add(getBanditArmFromResultSet(rs, profileName));
            }
        });

        return arms;
    }

    @Override
    public void insertBanditArmIfAbsent(String userId, String goalGroup, String profileName, double successes, double failures) {
        template.update(INSERT_BANDIT_ARM_IF_ABSENT_SQL, Map.of(
                "userId", userId,
                "goalGroup", goalGroup,
                "profileName", profileName,
                "successes", successes,
                "failures", failures,
                "updateInstant", Timestamp.from(Instant.now())));
    }

    @Override
    public BanditArmState incrementBanditArm(String userId, String goalGroup, String profileName, double reward) {
        BanditArmState firstRewardedArm = BanditArmState.initial(userId, goalGroup, ProfileName.getProfileNameByName(profileName)).withReward(reward);

        return template.queryForObject(INCREMENT_BANDIT_ARM_SQL, Map.of(
                        "userId", userId,
                        "goalGroup", goalGroup,
                        "profileName", profileName,
                        "initialSuccesses", firstRewardedArm.successes(),
                        "initialFailures", firstRewardedArm.failures(),
                        "reward", reward,
                        "penalty", 1.0 - reward,
                        "updateInstant", Timestamp.from(Instant.now())),
                (rs, rowNum) -> getBanditArmFromResultSet(rs, ProfileName.getProfileNameByName(rs.getString("profile_name"))));
    }

    private static BanditArmState getBanditArmFromResultSet(ResultSet rs, ProfileName profileName) throws SQLException {
        return new BanditArmState(
                rs.getString("user_id"),
                rs.getString("goal_group"),
                profileName,
                rs.getDouble("successes"),
                rs.getDouble("failures"));
    }
}
