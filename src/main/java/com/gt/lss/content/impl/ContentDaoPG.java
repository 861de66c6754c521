package com.gt.lss.content.impl;

import com.gt.lss.content.ContentDao;
import com.gt.lss.model.CandidateItem;
import com.gt.lss.model.Goal;
import com.gt.lss.model.PrerequisiteEdge;
import com.gt.lss.util.BatchUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

public class ContentDaoPG implements ContentDao {

    private static final Logger log = LoggerFactory.getLogger(ContentDaoPG.class);

    static final String PREREQUISITE_EDGE_TYPE = "prerequisite";

    private static final String FETCH_CANDIDATES_SQL =
            "SELECT gi.item_id, m.foundational_score, m.influence_score, m.difficulty_score, m.canonical_order, s.energy, s.next_due_at " +
            "FROM goal_items gi " +
            "LEFT JOIN item_metadata m ON m.item_id = gi.item_id " +
            "LEFT JOIN user_memory_states s ON s.item_id = gi.item_id AND s.user_id = :userId " +
            "WHERE gi.goal_id = :goalId AND (s.item_id IS NULL OR s.energy IS NULL OR s.energy = 0 OR s.next_due_at <= :now)";

    private static final String FETCH_PREREQUISITE_PARENTS_SQL =
            "SELECT parent_id, child_id " +
            "FROM item_edges " +
            "WHERE edge_type = :edgeType AND child_id IN (:itemIds) " +
            "ORDER BY child_id, parent_id";

    private static final String LOAD_GOAL_SQL =
            "SELECT goal_id, goal_group, label FROM goals WHERE goal_id = :goalId";

    private final NamedParameterJdbcTemplate template;
    private final int queryChunkSize;

    public ContentDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, int queryChunkSize) {
        this.template = namedParameterJdbcTemplate;
        this.queryChunkSize = queryChunkSize;
    }

    @Override
    public List<CandidateItem> fetchCandidates(String goalId, String userId, Instant now) {
        return template.query(FETCH_CANDIDATES_SQL, Map.of(
                        "goalId", goalId,
                        "userId", userId,
                        "now", Timestamp.from(now)),
                ContentDaoPG::getCandidateItemFromResultSet);
    }

    @Override
    public Map<String, List<String>> fetchPrerequisiteParents(Collection<String> itemIds) {
        Map<String, List<String>> parentIdsByChildId = new HashMap<>();

        for (List<String> chunk : BatchUtil.partition(new LinkedHashSet<>(itemIds), queryChunkSize)) {
            List<PrerequisiteEdge> edges = template.query(FETCH_PREREQUISITE_PARENTS_SQL, Map.of(
                            "edgeType", PREREQUISITE_EDGE_TYPE,
                            "itemIds", chunk),
                    (rs, rowNum) -> new PrerequisiteEdge(rs.getString("parent_id"), rs.getString("child_id")));

            for (PrerequisiteEdge edge : edges) {
                parentIdsByChildId.computeIfAbsent(edge.childId(), childId -> new ArrayList<>()).add(edge.parentId());
            }
        }

        log.debug("Loaded prerequisite parents for {} of {} items", parentIdsByChildId.size(), itemIds.size());

        return parentIdsByChildId;
    }

    @Override
    public Optional<Goal> loadGoal(String goalId) {
        List<Goal> goals = template.query(LOAD_GOAL_SQL, Map.of("goalId", goalId),
                (rs, rowNum) -> new Goal(rs.getString("goal_id"), rs.getString("goal_group"), rs.getString("label")));

        return goals.stream().findFirst();
    }

    // Missing metadata columns read as 0.0 through getDouble
    private static CandidateItem getCandidateItemFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        long canonicalOrder = rs.getLong("canonical_order");
        if (rs.wasNull()) {
            canonicalOrder = CandidateItem.UNORDERED;
        }

        return new CandidateItem(
                rs.getString("item_id"),
                rs.getDouble("foundational_score"),
                rs.getDouble("influence_score"),
                rs.getDouble("difficulty_score"),
                clampEnergy(rs.getDouble("energy")),
                toInstant(rs.getTimestamp("next_due_at")),
                canonicalOrder);
    }

    private static double clampEnergy(double energy) {
        return Math.max(0.0, Math.min(1.0, energy));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
