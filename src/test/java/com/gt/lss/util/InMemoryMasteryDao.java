package com.gt.lss.util;

import com.gt.lss.mastery.MasteryDao;

import java.util.*;

public class InMemoryMasteryDao implements MasteryDao {

    private final Map<String, Map<String, Double>> energiesByUser = new HashMap<>();

    private RuntimeException failure;
    private final List<Collection<String>> requests = new ArrayList<>();

    public InMemoryMasteryDao setEnergy(String userId, String itemId, double energy) {
        energiesByUser.computeIfAbsent(userId, u -> new HashMap<>()).put(itemId, energy);
        return this;
    }

    public void fail(RuntimeException ex) {
        this.failure = ex;
    }

    public List<Collection<String>> getRequests() {
        return requests;
    }

    @Override
    public Map<String, Double> fetchEnergies(String userId, Collection<String> itemIds) {
        requests.add(List.copyOf(itemIds));
        if (failure != null) {
            throw failure;
        }

        Map<String, Double> userEnergies = energiesByUser.getOrDefault(userId, Map.of());

        List<String> reversedIds = new ArrayList<>(itemIds);
        Collections.reverse(reversedIds);

        Map<String, Double> energies = new LinkedHashMap<>();
        for (String itemId : reversedIds) {
            if (userEnergies.containsKey(itemId)) {
                energies.put(itemId, userEnergies.get(itemId));
            }
        }

        return energies;
    }
}
