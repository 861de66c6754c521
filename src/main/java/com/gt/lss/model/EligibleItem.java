package com.gt.lss.model;

// An item that passed the prerequisite gate, along with the readiness computed from its parents
public record EligibleItem(EnrichedItem enrichedItem, double readiness) {

    public CandidateItem item() {
        return enrichedItem.item();
    }
}
