package com.gt.lss.content;

import com.gt.lss.model.CandidateItem;
import com.gt.lss.model.Goal;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ContentDao {

    // Items of the goal that are either due at {@code now} or have never been learned by the user
    List<CandidateItem> fetchCandidates(String goalId, String userId, Instant now);

    // Prerequisite-kind parents keyed by child id. Items without parents may be absent from the map.
    Map<String, List<String>> fetchPrerequisiteParents(Collection<String> itemIds);

    Optional<Goal> loadGoal(String goalId);
}
