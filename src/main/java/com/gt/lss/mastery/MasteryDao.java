package com.gt.lss.mastery;

import java.util.Collection;
import java.util.Map;

public interface MasteryDao {

    // Items the user has no memory state for are absent from the result
    Map<String, Double> fetchEnergies(String userId, Collection<String> itemIds);
}
