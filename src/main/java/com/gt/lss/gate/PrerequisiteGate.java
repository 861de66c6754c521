package com.gt.lss.gate;

import com.gt.lss.model.EligibleItem;
import com.gt.lss.model.EnrichedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drops items whose prerequisite parents are not yet sufficiently mastered.
 *
 * <p>The gate is evaluated once per session generation against the energies loaded for that pass. Scheduling an
 * item does not unlock its children until the next pass. The prerequisite graph is assumed acyclic.</p>
 */
@Component
public class PrerequisiteGate {

    private static final Logger log = LoggerFactory.getLogger(PrerequisiteGate.class);

    public static final double DEFAULT_MASTERY_THRESHOLD = 0.3;

    private final double masteryThreshold;

    @Autowired
    public PrerequisiteGate(@Value("${lss.gate.masteryThreshold:0.3}") double masteryThreshold) {
        if (!(masteryThreshold >= 0.0 && masteryThreshold <= 1.0)) {
            throw new IllegalArgumentException("Mastery threshold must be within [0, 1]. Received " + masteryThreshold);
        }

        this.masteryThreshold = masteryThreshold;
    }

    /**
     * @param items           candidates joined with their prerequisite parents
     * @param parentEnergies  user energy per parent id; a missing parent counts as 0.0
     * @return eligible items in input order, each with its readiness
     */
    public List<EligibleItem> apply(List<EnrichedItem> items, Map<String, Double> parentEnergies) {
        List<EligibleItem> eligibleItems = new ArrayList<>(items.size());

        for (EnrichedItem item : items) {
            if (countUnsatisfiedParents(item.parentIds(), parentEnergies) == 0) {
                eligibleItems.add(new EligibleItem(item, calculateReadiness(item.parentIds(), parentEnergies)));
            }
        }

        log.debug("Prerequisite gate passed {} of {} items", eligibleItems.size(), items.size());

        return eligibleItems;
    }

    public int countUnsatisfiedParents(List<String> parentIds, Map<String, Double> parentEnergies) {
        if (parentIds == null) {
            return 0;
        }

        int unsatisfied = 0;
        for (String parentId : parentIds) {
            if (getEnergy(parentId, parentEnergies) < masteryThreshold) {
                unsatisfied++;
            }
        }

        return unsatisfied;
    }

    // 1.0 for items without prerequisites, otherwise the mean parent energy
    public double calculateReadiness(List<String> parentIds, Map<String, Double> parentEnergies) {
        if (parentIds == null || parentIds.isEmpty()) {
            return 1.0;
        }

        double total = 0.0;
        for (String parentId : parentIds) {
            total += getEnergy(parentId, parentEnergies);
        }

        return total / parentIds.size();
    }

    public double getMasteryThreshold() {
        return masteryThreshold;
    }

    private static double getEnergy(String parentId, Map<String, Double> parentEnergies) {
        Double energy = parentEnergies.get(parentId);

        return energy == null ? 0.0 : energy;
    }
}
