package com.gt.lss.mastery.impl;

import com.gt.lss.mastery.MasteryDao;
import com.gt.lss.util.BatchUtil;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.*;

public class MasteryDaoPG implements MasteryDao {

    private static final String FETCH_ENERGIES_SQL =
            "SELECT item_id, energy " +
            "FROM user_memory_states " +
            "WHERE user_id = :userId AND item_id IN (:itemIds)";

    private final NamedParameterJdbcTemplate template;
    private final int queryChunkSize;

    public MasteryDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, int queryChunkSize) {
        this.template = namedParameterJdbcTemplate;
        this.queryChunkSize = queryChunkSize;
    }

    @Override
    public Map<String, Double> fetchEnergies(String userId, Collection<String> itemIds) {
        Map<String, Double> energyByItemId = new HashMap<>();

        for (List<String> chunk : BatchUtil.partition(new LinkedHashSet<>(itemIds), queryChunkSize)) {
            List<Map.Entry<String, Double>> energies = template.query(FETCH_ENERGIES_SQL, Map.of(
                            "userId", userId,
                            "itemIds", chunk),
                    (rs, rowNum) -> Map.entry(rs.getString("item_id"), rs.getDouble("energy")));

            for (Map.Entry<String, Double> energy : energies) {
                energyByItemId.put(energy.getKey(), energy.getValue());
            }
        }

        return energyByItemId;
    }
}
